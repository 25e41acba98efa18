module com.marginal.core {
    // Exports - all public packages
    exports com.marginal.core.model;
    exports com.marginal.core.source;

    // Jackson annotations on the model records
    requires transitive com.fasterxml.jackson.annotation;

    // Jackson needs reflection access to models
    opens com.marginal.core.model to com.fasterxml.jackson.databind;
}
