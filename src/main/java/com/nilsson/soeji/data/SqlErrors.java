package com.nilsson.soeji.data;

import org.sqlite.SQLiteErrorCode;
import org.sqlite.SQLiteException;

import java.sql.SQLException;

final class SqlErrors {

    private SqlErrors() {
    }

    /**
     True if the exception, or one it was chained from, reports a violated UNIQUE or PRIMARY KEY
     constraint.
     */
    static boolean isUniqueViolation(SQLException e) {
        Throwable current = e;
        while (current != null) {
            if (current instanceof SQLiteException) {
                SQLiteErrorCode code = ((SQLiteException) current).getResultCode();
                if (code == SQLiteErrorCode.SQLITE_CONSTRAINT_UNIQUE
                        || code == SQLiteErrorCode.SQLITE_CONSTRAINT_PRIMARYKEY) {
                    return true;
                }
            }
            String message = current.getMessage();
            if (message != null && message.contains("UNIQUE constraint failed")) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }
}
