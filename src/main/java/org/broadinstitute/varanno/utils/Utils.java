package org.broadinstitute.varanno.utils;

import com.google.common.collect.AbstractIterator;
import com.google.common.collect.Iterators;
import org.broadinstitute.varanno.exceptions.VarAnnoException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedList;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Argument checking, string and parallel iteration helpers shared by the annotation code.
 */
public final class Utils {

    /**
     * Static utilities class, do not instantiate.
     */
    private Utils() {}

    /**
     * Checks that an Object {@code object} is not null and returns the same object or throws an {@link IllegalArgumentException}
     * @param object any Object
     * @return the same object
     * @throws IllegalArgumentException if a {@code o == null}
     */
    public static <T> T nonNull(final T object) {
        return Utils.nonNull(object, "Null object is not allowed here.");
    }

    /**
     * Checks that an {@link Object} is not {@code null} and returns the same object or throws an {@link IllegalArgumentException}
     * @param object any Object
     * @param message the text message that would be passed to the exception thrown when {@code o == null}.
     * @return the same object
     * @throws IllegalArgumentException if a {@code o == null}
     */
    public static <T> T nonNull(final T object, final String message) {
        if (object == null) {
            throw new IllegalArgumentException(message);
        }
        return object;
    }

    public static <T> T nonNull(final T object, final Supplier<String> message) {
        if (object == null) {
            throw new IllegalArgumentException(message.get());
        }
        return object;
    }

    /**
     * Checks that a {@link String} is not {@code null} and that it is not empty.
     * @param string any String
     * @param message a message to include in the output
     * @return the original string
     * @throws IllegalArgumentException if string is null or empty
     */
    public static String nonEmpty(final String string, final String message){
        nonNull(string, "The string is null: " + message);
        if(string.isEmpty()){
            throw new IllegalArgumentException("The string is empty: " + message);
        }
        return string;
    }

    /**
     * Checks that the collection does not contain a {@code null} value (throws an {@link IllegalArgumentException} if it does).
     * @param collection collection
     * @param message the text message that would be pass to the exception thrown when c contains a null.
     * @throws IllegalArgumentException if collection is null or contains any null elements
     */
    public static void containsNoNull(final Collection<?> collection, final String message) {
        Utils.nonNull(collection, message);
        //cannot use Collection.contains(null) here because this throws a NullPointerException when used with many Sets
        if (collection.stream().anyMatch(v -> v == null)){
            throw new IllegalArgumentException(message);
        }
    }

    public static void validateArg(final boolean condition, final String msg){
        if (!condition){
            throw new IllegalArgumentException(msg);
        }
    }

    public static void validateArg(final boolean condition, final Supplier<String> msg){
        if (!condition){
            throw new IllegalArgumentException(msg.get());
        }
    }

    /**
     * Check a condition that should always be true and throw an {@link IllegalStateException} if false.
     */
    public static void validate(final boolean condition, final Supplier<String> msg){
        if (!condition){
            throw new IllegalStateException(msg.get());
        }
    }

    /**
     * Splits a {@link String} on any of the given delimiter characters, keeping empty tokens.
     * Unlike {@link String#split(String)} trailing empty tokens are kept too, so {@code "A/"} yields two tokens.
     * @param str the string to split.  Must not be {@code null}.
     * @param delimiters characters that separate tokens.  Must not be {@code null} or empty.
     * @return the tokens in input order.
     */
    public static List<String> split(final String str, final String delimiters) {
        Utils.nonNull(str, "str");
        Utils.nonEmpty(delimiters, "delimiters");

        final List<String> tokens = new ArrayList<>();
        int tokenStart = 0;
        for ( int i = 0; i < str.length(); ++i ) {
            if ( delimiters.indexOf(str.charAt(i)) >= 0 ) {
                tokens.add(str.substring(tokenStart, i));
                tokenStart = i + 1;
            }
        }
        tokens.add(str.substring(tokenStart));
        return tokens;
    }

    /**
     * Like Guava's {@link Iterators#transform(Iterator, com.google.common.base.Function)}, but runs a fixed number
     * of threads to perform the function onto the input iterator.  Results come back in input order.
     * @param fromIterator the input iterator.  Must not be {@code null}.
     * @param function the function to apply to each element.  Must not be {@code null}.
     * @param numThreads number of worker threads.  Must be at least 1.
     * @return an iterator over the transformed elements.
     * @throws VarAnnoException if {@code function} fails on any element or a worker is interrupted.
     */
    public static <F, T> Iterator<T> transformParallel(final Iterator<F> fromIterator, final Function<F, T> function, final int numThreads) {
        Utils.nonNull(fromIterator, "fromIterator");
        Utils.nonNull(function, "function");
        Utils.validateArg(numThreads >= 1, "numThreads must be at least 1");

        if (numThreads == 1) {
            return Iterators.transform(fromIterator, function::apply);
        }
        final ExecutorService executorService = Executors.newFixedThreadPool(numThreads);
        final Queue<Future<T>> futures = new LinkedList<>();
        return new AbstractIterator<T>() {
            @Override
            protected T computeNext() {
                try {
                    while (fromIterator.hasNext()) {
                        if (futures.size() == numThreads) {
                            return futures.remove().get();
                        }
                        final F next = fromIterator.next();
                        futures.add(executorService.submit(() -> function.apply(next)));
                    }
                    if (!futures.isEmpty()) {
                        return futures.remove().get();
                    }
                    executorService.shutdown();
                    return endOfData();
                } catch (final InterruptedException | ExecutionException e) {
                    executorService.shutdownNow();
                    if (e instanceof InterruptedException) {
                        Thread.currentThread().interrupt();
                    }
                    throw new VarAnnoException("Problem running task", e);
                }
            }
        };
    }
}
