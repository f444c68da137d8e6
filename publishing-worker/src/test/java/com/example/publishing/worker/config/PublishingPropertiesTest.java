package com.example.publishing.worker.config;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 调度配置校验测试
 */
class PublishingPropertiesTest {

    private static ValidatorFactory factory;
    private static Validator validator;

    @BeforeAll
    static void setUpValidator() {
        factory = Validation.buildDefaultValidatorFactory();
        validator = factory.getValidator();
    }

    @AfterAll
    static void closeValidator() {
        factory.close();
    }

    @Test
    void defaultsAreValid() {
        assertTrue(validator.validate(new PublishingProperties()).isEmpty());
    }

    @Test
    void zeroPollIntervalIsRejected() {
        PublishingProperties properties = new PublishingProperties();
        properties.getScheduler().setPollInterval(Duration.ZERO);

        Set<ConstraintViolation<PublishingProperties>> violations = validator.validate(properties);

        assertEquals(1, violations.size());
        assertEquals("scheduler.pollInterval", violations.iterator().next().getPropertyPath().toString());
    }

    @Test
    void negativeDelaysAreRejected() {
        PublishingProperties properties = new PublishingProperties();
        properties.getDispatch().setInterRecipientDelay(Duration.ofMillis(-1));
        properties.getDispatch().setInterBatchDelay(Duration.ofMillis(-1));

        assertEquals(2, validator.validate(properties).size());
    }

    @Test
    void zeroDelaysAreAllowed() {
        PublishingProperties properties = new PublishingProperties();
        properties.getDispatch().setInterRecipientDelay(Duration.ZERO);
        properties.getDispatch().setInterBatchDelay(Duration.ZERO);

        assertTrue(validator.validate(properties).isEmpty());
    }

    @Test
    void blankDeliveryEndpointIsRejected() {
        PublishingProperties properties = new PublishingProperties();
        properties.getDelivery().setEndpoint(" ");

        assertEquals(1, validator.validate(properties).size());
    }
}
