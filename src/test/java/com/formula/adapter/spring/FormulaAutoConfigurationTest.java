package com.formula.adapter.spring;

import com.formula.config.FormulaConfig;
import com.formula.engine.FormulaEngine;
import com.formula.grid.InMemoryWorkbook;
import com.formula.layout.Position;
import com.formula.value.NumberValue;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for FormulaAutoConfiguration.
 */
class FormulaAutoConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(FormulaAutoConfiguration.class));

    @Test
    @DisplayName("Should create the engine from the bundled configuration")
    void shouldCreateEngine() {
        runner.run(context -> {
            FormulaEngine engine = context.getBean(FormulaEngine.class);
            assertEquals("default-engine", engine.getConfig().name());

            InMemoryWorkbook workbook = new InMemoryWorkbook();
            workbook.addSheet("Sheet1").setValue(Position.of(1, 1), new NumberValue(2));
            assertEquals(new NumberValue(4), engine.evaluate("sum(A1, A1)", engine.context(workbook)));
        });
    }

    @Test
    @DisplayName("Should read the configuration path from properties")
    void shouldUseConfiguredPath() {
        runner.withPropertyValues("formula.config-path=classpath:formula-test.yaml")
                .run(context -> {
                    FormulaConfig config = context.getBean(FormulaConfig.class);
                    assertEquals("test-engine", config.name());
                    assertFalse(config.cycleDetection());
                });
    }

    @Test
    @DisplayName("Should back off when disabled")
    void shouldBackOffWhenDisabled() {
        runner.withPropertyValues("formula.enabled=false")
                .run(context -> assertTrue(context.getBeansOfType(FormulaEngine.class).isEmpty()));
    }

    @Test
    @DisplayName("Should keep a user-defined configuration")
    void shouldKeepUserConfiguration() {
        FormulaConfig custom = new FormulaConfig("custom", false, true, null, null);

        runner.withBean(FormulaConfig.class, () -> custom)
                .run(context -> {
                    assertSame(custom, context.getBean(FormulaConfig.class));
                    assertEquals("custom", context.getBean(FormulaEngine.class).getConfig().name());
                });
    }
}
