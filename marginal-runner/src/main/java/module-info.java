module com.marginal.runner {
    // Internal modules
    requires com.marginal.core;
    requires com.marginal.engine;
    requires com.marginal.data;

    // Data/IO
    requires com.fasterxml.jackson.databind;
    requires com.fasterxml.jackson.datatype.jsr310;

    // Logging
    requires org.slf4j;

    exports com.marginal.runner;
}
