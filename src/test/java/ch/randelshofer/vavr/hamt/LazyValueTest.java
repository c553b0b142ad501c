package ch.randelshofer.vavr.hamt;

import io.vavr.CheckedFunction1;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class LazyValueTest {

    @Test
    public void shouldNotEvaluateUntilAccessed() {
        final AtomicInteger calls = new AtomicInteger();
        final LazyValue<Integer> lazy = LazyValue.of(calls::incrementAndGet);
        assertThat(lazy.isEvaluated()).isFalse();
        assertThat(calls.get()).isEqualTo(0);
        assertThat(lazy.toString()).isEqualTo("LazyValue(?)");
    }

    @Test
    public void shouldEvaluateOnlyOnce() {
        final AtomicInteger calls = new AtomicInteger();
        final LazyValue<Integer> lazy = LazyValue.of(calls::incrementAndGet);
        assertThat(lazy.get()).isEqualTo(1);
        assertThat(lazy.get()).isEqualTo(1);
        assertThat(calls.get()).isEqualTo(1);
        assertThat(lazy.isEvaluated()).isTrue();
        assertThat(lazy.toString()).isEqualTo("LazyValue(1)");
    }

    @Test
    public void shouldApplyFunctionToCapturedArguments() {
        assertThat(LazyValue.of((Integer a) -> a * 2, 21).get()).isEqualTo(42);
        assertThat(LazyValue.of((String a, String b) -> a + b, "x", "y").get()).isEqualTo("xy");
        assertThat(LazyValue.of((Integer a, Integer b, Integer c) -> a + b + c, 1, 2, 3).get()).isEqualTo(6);
    }

    @Test
    public void shouldEvaluateOnlyOnceUnderContention() throws Exception {
        final AtomicInteger calls = new AtomicInteger();
        final CountDownLatch start = new CountDownLatch(1);
        final LazyValue<String> lazy = LazyValue.of(() -> {
            calls.incrementAndGet();
            Thread.sleep(50);
            return "done";
        });
        final ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            final List<Future<String>> results = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                results.add(executor.submit(() -> {
                    start.await();
                    return lazy.get();
                }));
            }
            start.countDown();
            for (Future<String> result : results) {
                assertThat(result.get(10, TimeUnit.SECONDS)).isEqualTo("done");
            }
        } finally {
            executor.shutdownNow();
        }
        assertThat(calls.get()).isEqualTo(1);
    }

    @Test
    public void shouldRetryAfterFailure() {
        final AtomicInteger calls = new AtomicInteger();
        final LazyValue<Integer> lazy = LazyValue.of(() -> {
            if (calls.incrementAndGet() == 1) {
                throw new IOException("first call fails");
            }
            return 7;
        });
        assertThatThrownBy(lazy::get)
                .isInstanceOf(LazyEvaluationException.class)
                .hasCauseInstanceOf(IOException.class);
        assertThat(lazy.isEvaluated()).isFalse();
        assertThat(lazy.get()).isEqualTo(7);
        assertThat(lazy.get()).isEqualTo(7);
        assertThat(calls.get()).isEqualTo(2);
        assertThat(lazy.isEvaluated()).isTrue();
    }

    @Test
    public void shouldNameFunctionAndArgumentsOnFailure() {
        final LazyValue<Integer> lazy = LazyValue.of(new DivideByZero(), 5);
        assertThatThrownBy(lazy::get)
                .isInstanceOf(LazyEvaluationException.class)
                .hasMessageContaining(DivideByZero.class.getName() + "(5)")
                .hasCauseInstanceOf(ArithmeticException.class);
    }

    @Test
    public void shouldNameLambdaAsAnonymousOnFailure() {
        final LazyValue<Integer> lazy = LazyValue.of((Integer a, Integer b) -> a / b, 1, 0);
        assertThatThrownBy(lazy::get)
                .isInstanceOf(LazyEvaluationException.class)
                .hasMessageContaining("<anonymous>(1, 0)");
    }

    static final class DivideByZero implements CheckedFunction1<Integer, Integer> {
        private static final long serialVersionUID = 1L;

        @Override
        public Integer apply(Integer a) {
            return a / 0;
        }
    }

    @Test
    public void shouldRethrowErrorsUnwrapped() {
        final LazyValue<Integer> lazy = LazyValue.of(() -> {
            throw new AssertionError("boom");
        });
        assertThatThrownBy(lazy::get).isInstanceOf(AssertionError.class).hasMessage("boom");
    }

    @Test
    public void shouldCreateEvaluatedValue() {
        final LazyValue<String> lazy = LazyValue.val("x");
        assertThat(lazy.isEvaluated()).isTrue();
        assertThat(lazy.get()).isEqualTo("x");
    }

    @Test
    public void shouldMapLazily() {
        final AtomicInteger calls = new AtomicInteger();
        final LazyValue<Integer> lazy = LazyValue.of(calls::incrementAndGet);
        final LazyValue<String> mapped = lazy.map(i -> "#" + i);
        assertThat(calls.get()).isEqualTo(0);
        assertThat(mapped.get()).isEqualTo("#1");
        assertThat(lazy.isEvaluated()).isTrue();
    }

    @Test
    public void shouldForceEvaluationOnEquals() {
        final LazyValue<Integer> a = LazyValue.of(() -> 1);
        final LazyValue<Integer> b = LazyValue.of(() -> 1);
        assertThat(a.equals(b)).isTrue();
        assertThat(a.isEvaluated()).isTrue();
        assertThat(b.isEvaluated()).isTrue();
        assertThat(a.hashCode()).isEqualTo(Integer.hashCode(1));
        assertThat(a.equals(LazyValue.val(2))).isFalse();
    }

    @Test
    public void shouldForceEvaluationOnSerialization() throws IOException, ClassNotFoundException {
        final LazyValue<Integer> lazy = LazyValue.of(() -> 42);
        final LazyValue<Integer> copy = HashTrieTest.roundTrip(lazy);
        assertThat(lazy.isEvaluated()).isTrue();
        assertThat(copy.isEvaluated()).isTrue();
        assertThat(copy.get()).isEqualTo(42);
    }
}
