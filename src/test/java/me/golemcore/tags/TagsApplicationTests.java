package me.golemcore.tags;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

import static org.junit.jupiter.api.Assertions.assertNotNull;

class TagsApplicationTests {

    @Test
    void shouldHaveExpectedSpringAnnotations() {
        assertNotNull(TagsApplication.class.getAnnotation(SpringBootApplication.class));
        assertNotNull(TagsApplication.class.getAnnotation(ConfigurationPropertiesScan.class));
    }

    @Test
    void shouldExposeMainMethod() throws NoSuchMethodException {
        assertNotNull(TagsApplication.class.getMethod("main", String[].class));
    }
}
