package FSA;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.BitSet;
import java.util.Collection;
import java.util.List;

public class BitSetUtilsTest {
  // Only for tests, not meant to be performant
  static BitSet convertListToBitSet(Collection<Integer> list) {
    BitSet b = new BitSet();
    for (int i : list) {
      b.set(i);
    }
    return b;
  }

  @Test
  void testSubset() {
    BitSet small = convertListToBitSet(List.of(1, 3));
    BitSet big = convertListToBitSet(List.of(0, 1, 3, 5));
    Assertions.assertTrue(BitSetUtils.isSubset(small, big));
    Assertions.assertFalse(BitSetUtils.isSubset(big, small));
    Assertions.assertTrue(BitSetUtils.isSubset(new BitSet(), small));
  }

  @Test
  void testSetOperations() {
    BitSet a = convertListToBitSet(List.of(0, 1, 2));
    BitSet b = convertListToBitSet(List.of(1, 2, 3));
    Assertions.assertEquals(convertListToBitSet(List.of(0)), BitSetUtils.minus(a, b));
    Assertions.assertEquals(convertListToBitSet(List.of(0, 1, 2)), a); // arguments untouched
    Assertions.assertEquals(convertListToBitSet(List.of(7)), BitSetUtils.singleton(7));
  }
}
