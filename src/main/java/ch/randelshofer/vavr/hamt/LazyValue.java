/* ____  ______________  ________________________  __________
 * \   \/   /      \   \/   /   __/   /      \   \/   /      \
 *  \______/___/\___\______/___/_____/___/\___\______/___/\___\
 *
 * The MIT License (MIT)
 *
 * Copyright 2023 Vavr, https://vavr.io
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */
package ch.randelshofer.vavr.hamt;

import io.vavr.CheckedFunction0;
import io.vavr.CheckedFunction1;
import io.vavr.CheckedFunction2;
import io.vavr.CheckedFunction3;

import java.io.IOException;
import java.io.ObjectOutputStream;
import java.io.Serializable;
import java.util.Arrays;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * A value that is computed on first access and then cached.
 * <p>
 * The computation is a function together with the arguments it is applied
 * to. It runs at most once per successful evaluation: concurrent callers of
 * {@link #get()} block until the first caller has stored the value, then
 * read it. After the value is stored, the function and its arguments are
 * released.
 * <p>
 * If the computation fails, the failure is not cached: {@link #get()} throws a
 * {@link LazyEvaluationException} and the next call runs the computation
 * again. A computation that calls {@code get()} on its own lazy value
 * recurses until the stack overflows.
 * <p>
 * Lazy values can be stored as values of a {@link HashTrie}. They must not
 * be used as keys.
 *
 * @param <T> the type of the value
 */
public final class LazyValue<T> implements Supplier<T>, Serializable {

    private static final long serialVersionUID = 1L;

    // read by get() without holding the lock; null once the value is stored
    private transient volatile CheckedFunction0<? extends T> supplier;

    // only kept for the error message
    private transient Object function;
    private transient Object[] arguments;

    @SuppressWarnings("serial") // Conditionally serializable
    private T value; // published by the volatile write of supplier

    private LazyValue(CheckedFunction0<? extends T> supplier, Object function, Object[] arguments) {
        this.function = function;
        this.arguments = arguments;
        this.supplier = supplier;
    }

    private LazyValue(T value) {
        this.value = value;
        this.supplier = null;
    }

    /**
     * Creates a lazy value from a computation without arguments.
     *
     * @param supplier the computation
     * @param <T>      the type of the value
     * @return a new lazy value
     */
    public static <T> LazyValue<T> of(CheckedFunction0<? extends T> supplier) {
        Objects.requireNonNull(supplier, "supplier is null");
        return new LazyValue<>(supplier, supplier, new Object[0]);
    }

    public static <A, T> LazyValue<T> of(CheckedFunction1<? super A, ? extends T> function, A a) {
        Objects.requireNonNull(function, "function is null");
        return new LazyValue<>(() -> function.apply(a), function, new Object[]{a});
    }

    public static <A, B, T> LazyValue<T> of(CheckedFunction2<? super A, ? super B, ? extends T> function, A a, B b) {
        Objects.requireNonNull(function, "function is null");
        return new LazyValue<>(() -> function.apply(a, b), function, new Object[]{a, b});
    }

    public static <A, B, C, T> LazyValue<T> of(CheckedFunction3<? super A, ? super B, ? super C, ? extends T> function,
                                               A a, B b, C c) {
        Objects.requireNonNull(function, "function is null");
        return new LazyValue<>(() -> function.apply(a, b, c), function, new Object[]{a, b, c});
    }

    /**
     * Creates an already evaluated lazy value.
     *
     * @param value the value
     * @param <T>   the type of the value
     * @return a new lazy value
     */
    public static <T> LazyValue<T> val(T value) {
        return new LazyValue<>(value);
    }

    /**
     * Returns the value, computing it on the first call.
     *
     * @return the value
     * @throws LazyEvaluationException if the computation fails
     */
    @Override
    public T get() {
        return (supplier == null) ? value : computeValue();
    }

    private synchronized T computeValue() {
        final CheckedFunction0<? extends T> s = supplier;
        if (s != null) {
            try {
                value = s.apply();
            } catch (Error e) {
                throw e;
            } catch (Throwable t) {
                if (t instanceof InterruptedException) {
                    Thread.currentThread().interrupt();
                }
                throw new LazyEvaluationException("lazy value raised error during call to "
                        + describeCall(), t);
            }
            function = null;
            arguments = null;
            supplier = null;
        }
        return value;
    }

    // Lambdas and method references have no usable name.
    private String describeCall() {
        final Class<?> type = function.getClass();
        final String name = type.isSynthetic() ? "<anonymous>" : type.getName();
        return Arrays.stream(arguments)
                .map(String::valueOf)
                .collect(Collectors.joining(", ", name + "(", ")"));
    }

    /**
     * Checks, if this lazy value is evaluated. Does not trigger the evaluation.
     *
     * @return true, if the value is cached
     */
    public boolean isEvaluated() {
        return supplier == null;
    }

    /**
     * Returns a lazy value that applies the mapper to the value of this one
     * when it is first accessed.
     *
     * @param mapper a mapper
     * @param <U>    the type of the mapped value
     * @return a new lazy value
     */
    public <U> LazyValue<U> map(Function<? super T, ? extends U> mapper) {
        Objects.requireNonNull(mapper, "mapper is null");
        return LazyValue.of(() -> mapper.apply(get()));
    }

    @Override
    public boolean equals(Object o) {
        return (o == this) || (o instanceof LazyValue && Objects.equals(((LazyValue<?>) o).get(), get()));
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(get());
    }

    @Override
    public String toString() {
        return "LazyValue(" + (isEvaluated() ? value : "?") + ")";
    }

    /**
     * Ensures that the value is evaluated before serialization.
     *
     * @param s An object serialization stream.
     * @throws java.io.IOException If an error occurs writing to the stream.
     */
    private void writeObject(ObjectOutputStream s) throws IOException {
        get(); // evaluates the lazy value if it isn't evaluated yet!
        s.defaultWriteObject();
    }
}
