module com.marginal.engine {
    // Internal modules
    requires transitive com.marginal.core;

    // Logging
    requires org.slf4j;

    exports com.marginal.engine;
}
