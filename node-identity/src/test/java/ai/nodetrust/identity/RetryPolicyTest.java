// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.nodetrust.identity;

import ai.nodetrust.ValidationException;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class RetryPolicyTest {

    @Test
    void delay_doubles_up_to_max() {
        RetryPolicy policy = new RetryPolicy(10, Duration.ofMillis(200), Duration.ofMillis(1000));
        assertEquals(Duration.ofMillis(200), policy.delayAfter(1));
        assertEquals(Duration.ofMillis(400), policy.delayAfter(2));
        assertEquals(Duration.ofMillis(800), policy.delayAfter(3));
        assertEquals(Duration.ofMillis(1000), policy.delayAfter(4));
        assertEquals(Duration.ofMillis(1000), policy.delayAfter(1000));
    }

    @Test
    void invalid_policies_are_rejected() {
        assertThrows(ValidationException.class, () -> new RetryPolicy(0, Duration.ZERO, Duration.ZERO));
        assertThrows(ValidationException.class, () -> new RetryPolicy(1, Duration.ofMillis(-1), Duration.ZERO));
        assertThrows(ValidationException.class, () -> new RetryPolicy(1, Duration.ofMillis(10), Duration.ofMillis(5)));
        assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(1, Duration.ZERO, Duration.ZERO).delayAfter(0));
    }

}
