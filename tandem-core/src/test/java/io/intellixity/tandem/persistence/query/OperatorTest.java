package io.intellixity.tandem.persistence.query;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class OperatorTest {

  @Test
  void closedSetOfNineteen() {
    assertEquals(19, Operator.values().length);
  }

  @Test
  void parsesWireNamesAndConstants() {
    assertEquals(Operator.CONTAINED_BY, Operator.fromWireName("containedBy"));
    assertEquals(Operator.RANGE_ADJACENT, Operator.fromWireName("rangeadjacent"));
    assertEquals(Operator.NEQ, Operator.fromWireName("NEQ"));
    assertThrows(IllegalArgumentException.class, () -> Operator.fromWireName("between"));
  }

  @Test
  void rangeFlagOnlyOnRangeOperators() {
    int n = 0;
    for (Operator op : Operator.values()) if (op.isRange()) n++;
    assertEquals(5, n);
    assertFalse(Operator.GT.isRange());
  }

  @Test
  void offsetPageFromOneBasedPageNumber() {
    OffsetPage p = OffsetPage.of(3, 10);
    assertEquals(20, p.offset());
    assertEquals(3, p.pageNumber());
    assertThrows(IllegalArgumentException.class, () -> OffsetPage.of(0, 10));
  }

  @Test
  void pageResultComputesPageCountOnlyWhenCounted() {
    PageResult counted = PageResult.of(java.util.List.of(), OffsetPage.of(1, 10), 25L);
    assertEquals(3, counted.pageCount());
    PageResult uncounted = PageResult.of(java.util.List.of(), OffsetPage.of(1, 10), null);
    assertFalse(uncounted.hasCount());
  }
}
