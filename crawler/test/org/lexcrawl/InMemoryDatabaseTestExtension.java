package org.lexcrawl;

import org.junit.jupiter.api.extension.*;

/**
 * Resolves {@link Database} parameters to an in-memory database shared by the tests of one class.
 */
public class InMemoryDatabaseTestExtension implements BeforeAllCallback, AfterAllCallback, ParameterResolver {
    private static final ExtensionContext.Namespace NAMESPACE =
            ExtensionContext.Namespace.create(InMemoryDatabaseTestExtension.class);

    @Override
    public void beforeAll(ExtensionContext context) {
        context.getStore(NAMESPACE).put(Database.class, Database.newDatabaseInMemory());
    }

    @Override
    public void afterAll(ExtensionContext context) {
        var database = context.getStore(NAMESPACE).remove(Database.class, Database.class);
        if (database != null) database.close();
    }

    @Override
    public boolean supportsParameter(ParameterContext parameterContext, ExtensionContext extensionContext) {
        return parameterContext.getParameter().getType() == Database.class;
    }

    @Override
    public Object resolveParameter(ParameterContext parameterContext, ExtensionContext extensionContext) {
        ExtensionContext classContext = extensionContext;
        while (classContext.getTestMethod().isPresent() && classContext.getParent().isPresent()) {
            classContext = classContext.getParent().get();
        }
        return classContext.getStore(NAMESPACE).get(Database.class, Database.class);
    }

    public static void clear(Database database) {
        database.useHandle(handle -> {
            handle.execute("DELETE FROM documents");
            handle.execute("DELETE FROM sequence_counters");
            handle.execute("DELETE FROM frontier");
            handle.execute("DELETE FROM proxy_endpoints");
        });
    }
}
