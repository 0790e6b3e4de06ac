package relay.resilience;

import org.junit.jupiter.api.Test;
import relay.RetryAfterException;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ErrorClassifierTest {

  @Test
  void timeouts() {
    assertEquals(ErrorKind.TIMEOUT, ErrorClassifier.classify(new TimeoutException()));
    assertEquals(ErrorKind.TIMEOUT, ErrorClassifier.classify(new SocketTimeoutException("read")));
  }

  @Test
  void ioFailuresAreNetwork() {
    assertEquals(ErrorKind.NETWORK, ErrorClassifier.classify(new IOException("reset")));
    assertEquals(ErrorKind.NETWORK, ErrorClassifier.classify(
        new IllegalStateException("wrapped", new IOException("broken pipe"))));
  }

  @Test
  void networkHintsInMessages() {
    assertEquals(ErrorKind.NETWORK, ErrorClassifier.classify(new RuntimeException("Connection refused")));
    assertEquals(ErrorKind.NETWORK, ErrorClassifier.classify(new RuntimeException("HTTP 502 from upstream")));
    assertEquals(ErrorKind.NETWORK, ErrorClassifier.classify(
        new RuntimeException("send failed", new RuntimeException("request timed out"))));
  }

  @Test
  void retryAfterIsRateLimited() {
    assertEquals(ErrorKind.RATE_LIMITED, ErrorClassifier.classify(
        new ExecutionException(new RetryAfterException(Duration.ofSeconds(3)))));
    assertEquals(ErrorKind.RATE_LIMITED, ErrorClassifier.classify(RetryAfterException.ofSeconds(7)));
    assertEquals(Duration.ofSeconds(7), RetryAfterException.ofSeconds(7).retryAfter());
  }

  @Test
  void everythingElseIsRejected() {
    assertEquals(ErrorKind.REJECTED, ErrorClassifier.classify(new IllegalArgumentException("chat not found")));
    assertEquals(ErrorKind.REJECTED, ErrorClassifier.classify(new RuntimeException()));
    assertEquals(ErrorKind.REJECTED, ErrorClassifier.classify(null));
  }

  @Test
  void transientKinds() {
    assertTrue(ErrorKind.NETWORK.isTransient());
    assertTrue(ErrorKind.RATE_LIMITED.isTransient());
    assertFalse(ErrorKind.REJECTED.isTransient());
    assertFalse(ErrorKind.CIRCUIT_OPEN.isTransient());
  }
}
