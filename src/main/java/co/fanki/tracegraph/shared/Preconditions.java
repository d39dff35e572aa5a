package co.fanki.tracegraph.shared;

/**
 * Argument checks shared by the document, item and graph models.
 *
 * <p>Every check throws {@link IllegalArgumentException}, except
 * {@link #requireDomain(boolean, String, String)} which raises a
 * {@link DomainException} carrying an error code.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class Preconditions {

    private Preconditions() {
    }

    /**
     * Ensures that an object reference is not null.
     *
     * @param reference the object reference to check
     * @param message the exception message if null
     * @param <T> the type of the reference
     * @return the non-null reference
     * @throws IllegalArgumentException if reference is null
     */
    public static <T> T requireNonNull(final T reference, final String message) {
        if (reference == null) {
            throw new IllegalArgumentException(message);
        }
        return reference;
    }

    /**
     * Ensures that a string is not null or blank.
     *
     * @param value the string to check
     * @param message the exception message if null or blank
     * @return the non-blank string
     * @throws IllegalArgumentException if value is null or blank
     */
    public static String requireNonBlank(final String value,
            final String message) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(message);
        }
        return value;
    }

    /**
     * Ensures that a condition is true.
     *
     * @param condition the condition to check
     * @param message the exception message if false
     * @throws IllegalArgumentException if condition is false
     */
    public static void require(final boolean condition, final String message) {
        if (!condition) {
            throw new IllegalArgumentException(message);
        }
    }

    /**
     * Ensures that a condition is true, raising a coded domain exception.
     *
     * @param condition the condition to check
     * @param message the exception message if false
     * @param errorCode the error code carried by the exception
     * @throws DomainException if condition is false
     */
    public static void requireDomain(final boolean condition,
            final String message, final String errorCode) {
        if (!condition) {
            throw new DomainException(message, errorCode);
        }
    }

    /**
     * Ensures that a number lies within an inclusive range.
     *
     * @param value the number to check
     * @param min the lowest accepted value
     * @param max the highest accepted value
     * @param message the exception message if out of range
     * @return the value
     * @throws IllegalArgumentException if value is outside [min, max]
     */
    public static int requireInRange(final int value, final int min,
            final int max, final String message) {
        if (value < min || value > max) {
            throw new IllegalArgumentException(message);
        }
        return value;
    }

    /**
     * Ensures that a number is positive.
     *
     * @param value the number to check
     * @param message the exception message if not positive
     * @return the positive number
     * @throws IllegalArgumentException if value is not positive
     */
    public static int requirePositive(final int value, final String message) {
        if (value <= 0) {
            throw new IllegalArgumentException(message);
        }
        return value;
    }

}
