package io.github.flameyossnowy.tabula.sql.internals.repository;

import java.sql.PreparedStatement;
import java.sql.SQLException;

@FunctionalInterface
public interface StatementSetter {
    StatementSetter NONE = statement -> {};

    void set(PreparedStatement statement) throws SQLException;
}
