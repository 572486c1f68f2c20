package com.localflipper.db;

import com.localflipper.db.mybatis.MyBatisSupport;
import com.localflipper.db.mybatis.SavedSearchMapper;
import com.localflipper.db.mybatis.SavedSearchRow;
import org.apache.ibatis.session.SqlSession;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Saved search terms, returned in the order they were added.
 */
public final class SavedSearchDao {
    private final Database database;

    public SavedSearchDao(Database database) {
        this.database = database;
    }

    public List<String> listTerms() throws SQLException {
        List<String> out = new ArrayList<>();
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            for (SavedSearchRow row : session.getMapper(SavedSearchMapper.class).selectAll()) {
                if (row != null && row.getTerm() != null) {
                    out.add(row.getTerm());
                }
            }
        }
        return out;
    }

    /**
     * @return true when the term was new
     */
    public boolean addTerm(String term) throws SQLException {
        String value = normalize(term);
        if (value.isEmpty()) {
            throw new IllegalArgumentException("saved search term must not be blank");
        }
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            SavedSearchRow row = SavedSearchRow.builder()
                    .term(value)
                    .createdAt(Instant.now().toString())
                    .build();
            return session.getMapper(SavedSearchMapper.class).insertIgnore(row) > 0;
        }
    }

    /**
     * @return true when a stored term was removed
     */
    public boolean removeTerm(String term) throws SQLException {
        String value = normalize(term);
        if (value.isEmpty()) {
            return false;
        }
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            return session.getMapper(SavedSearchMapper.class).deleteByTerm(value) > 0;
        }
    }

    private static String normalize(String term) {
        return term == null ? "" : term.trim();
    }
}
