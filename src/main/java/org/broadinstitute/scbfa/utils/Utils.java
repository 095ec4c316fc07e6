package org.broadinstitute.scbfa.utils;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Argument and state checks shared by all scBFA components.
 *
 * <p>Argument checks throw {@link IllegalArgumentException}; {@link #validate} throws {@link IllegalStateException}.</p>
 */
public final class Utils {

    private Utils() {}

    /**
     * Returns {@code object} if it is not {@code null}.
     * @throws IllegalArgumentException with a generic message otherwise.
     */
    public static <T> T nonNull(final T object) {
        return nonNull(object, "Null object is not allowed here.");
    }

    /**
     * Returns {@code object} if it is not {@code null}.
     * @param message the exception message used when {@code object} is {@code null}.
     * @throws IllegalArgumentException otherwise.
     */
    public static <T> T nonNull(final T object, final String message) {
        if (object == null) {
            throw new IllegalArgumentException(message);
        }
        return object;
    }

    /**
     * Fails if the collection, or any of its elements, is {@code null}.
     */
    public static void containsNoNull(final Collection<?> collection, final String message) {
        nonNull(collection, message);
        // some Set implementations throw on contains(null)
        if (collection.stream().anyMatch(element -> element == null)) {
            throw new IllegalArgumentException(message);
        }
    }

    /**
     * Collects the elements of {@code collection} into an insertion-ordered set, failing on the first repeated element.
     *
     * @param message prefix of the exception message; the repeated element is appended to it.
     */
    public static <E> Set<E> checkForDuplicatesAndReturnSet(final Collection<E> collection, final String message) {
        final Set<E> result = new LinkedHashSet<>(collection.size());
        for (final E element : collection) {
            if (!result.add(element)) {
                throw new IllegalArgumentException(String.format("%s  Value %s appears more than once.", message, element));
            }
        }
        return result;
    }

    public static void validateArg(final boolean condition, final String message) {
        if (!condition) {
            throw new IllegalArgumentException(message);
        }
    }

    public static void validateArg(final boolean condition, final Supplier<String> message) {
        if (!condition) {
            throw new IllegalArgumentException(message.get());
        }
    }

    /**
     * Checks an internal invariant.
     * @throws IllegalStateException if {@code condition} is false.
     */
    public static void validate(final boolean condition, final Supplier<String> message) {
        if (!condition) {
            throw new IllegalStateException(message.get());
        }
    }
}
