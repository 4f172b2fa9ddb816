package ou.capstone.fantasy.history;

/** English ordinal suffixes: 1st, 2nd, 3rd, 4th, 11th, 21st. */
public final class Ordinals {

    private Ordinals() {
    }

    public static String suffix(final int n) {
        final int lastTwo = Math.abs(n) % 100;
        if (lastTwo >= 11 && lastTwo <= 13) {
            return "th";
        }
        switch (Math.abs(n) % 10) {
            case 1: return "st";
            case 2: return "nd";
            case 3: return "rd";
            default: return "th";
        }
    }

    public static String of(final int n) {
        return n + suffix(n);
    }
}
