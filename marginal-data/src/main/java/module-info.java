module com.marginal.data {
    // Internal modules
    requires transitive com.marginal.core;

    // Storage
    requires java.sql;
    requires org.xerial.sqlitejdbc;

    // Logging
    requires org.slf4j;

    exports com.marginal.data.sqlite;
}
