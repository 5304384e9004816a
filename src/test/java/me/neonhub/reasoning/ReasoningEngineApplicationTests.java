package me.neonhub.reasoning;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

import static org.junit.jupiter.api.Assertions.assertNotNull;

class ReasoningEngineApplicationTests {

    @Test
    void shouldHaveExpectedSpringAnnotations() {
        assertNotNull(ReasoningEngineApplication.class.getAnnotation(SpringBootApplication.class));
        assertNotNull(ReasoningEngineApplication.class.getAnnotation(ConfigurationPropertiesScan.class));
    }

    @Test
    void shouldExposeMainMethod() throws NoSuchMethodException {
        assertNotNull(ReasoningEngineApplication.class.getMethod("main", String[].class));
    }
}
