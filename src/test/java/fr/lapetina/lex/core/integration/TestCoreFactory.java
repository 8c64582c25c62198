package fr.lapetina.lex.core.integration;

import fr.lapetina.lex.core.CoreFactory;
import fr.lapetina.lex.core.optimizer.StubDownstreamModel;

import java.sql.SQLException;
import java.util.Map;

/**
 * Test extension of CoreFactory backed by a stub downstream model and no environment overrides.
 */
public final class TestCoreFactory extends CoreFactory {

    private TestCoreFactory(String configPath) {
        super(configPath, new StubDownstreamModel(), Map.of());
    }

    /**
     * Creates and starts a factory from the default test configuration.
     */
    public static TestCoreFactory startDefault() throws SQLException {
        return startFrom("test-config.yaml");
    }

    public static TestCoreFactory startFrom(String configPath) throws SQLException {
        TestCoreFactory factory = new TestCoreFactory(configPath);
        factory.start();
        return factory;
    }

    public StubDownstreamModel getStub() {
        return (StubDownstreamModel) getDownstream();
    }
}
