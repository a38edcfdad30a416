public class Opaque {
    static int sum(int[] values) {
        int total = 0;
        for (int v : values) {
            total += v;
        }
        while (total > 100) {
            total -= 100;
        }
        try {
            check(total);
        } catch (IllegalStateException e) {
            total = 0;
        }
        switch (total) {
            case 0:
                return 0;
            default:
                return total;
        }
    }
}
