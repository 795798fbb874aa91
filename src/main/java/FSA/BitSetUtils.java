package FSA;

import java.util.BitSet;

public class BitSetUtils {
    /**
     * Determine is sub is a subset of sup.
     */
    public static boolean isSubset(BitSet sub, BitSet sup) {
        for(int i=sub.nextSetBit(0);i>=0;i=sub.nextSetBit(i+1)) {
            if(!sup.get(i)) {
                return false;
            }
        }
        return true;
    }

    public static BitSet singleton(int index) {
        final BitSet bits = new BitSet(index + 1);
        bits.set(index);
        return bits;
    }

    /**
     * a \ b as a fresh set; neither argument is modified.
     */
    public static BitSet minus(BitSet a, BitSet b) {
        final BitSet result = (BitSet) a.clone();
        result.andNot(b);
        return result;
    }
}
