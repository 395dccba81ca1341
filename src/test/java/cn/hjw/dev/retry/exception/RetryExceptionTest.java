package cn.hjw.dev.retry.exception;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

public class RetryExceptionTest {

    @Test
    public void testMessageIsLastError() {
        IOException first = new IOException("connection refused");
        IllegalStateException last = new IllegalStateException("read timed out");

        RetryException ex = new RetryException(List.of(first, last));

        Assertions.assertEquals("read timed out", ex.getMessage());
        Assertions.assertSame(last, ex.getLastError());
        Assertions.assertSame(last, ex.getCause());
        Assertions.assertEquals(List.of(first, last), ex.getErrors());
        Assertions.assertEquals(2, ex.size());
    }

    @Test
    public void testErrorsAreDetachedAndReadOnly() {
        List<Exception> source = new ArrayList<>();
        source.add(new RuntimeException("a"));

        RetryException ex = new RetryException(source);
        source.add(new RuntimeException("b"));

        Assertions.assertEquals(1, ex.size());
        Assertions.assertThrows(UnsupportedOperationException.class,
                () -> ex.getErrors().add(new RuntimeException("c")));
    }

    @Test
    public void testNullMessagePassesThrough() {
        RetryException ex = new RetryException(List.of(new RuntimeException()));
        Assertions.assertNull(ex.getMessage());
    }

    @Test
    public void testEmptyErrorsRejected() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> new RetryException(List.of()));
    }
}
