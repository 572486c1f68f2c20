package com.localflipper.db.mybatis;

import org.apache.ibatis.annotations.Delete;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.util.List;

public interface SavedSearchMapper {
    @Select("SELECT id, term, created_at FROM saved_search ORDER BY id ASC")
    List<SavedSearchRow> selectAll();

    @Insert("INSERT INTO saved_search(term, created_at) VALUES(#{term}, #{createdAt}) " +
            "ON CONFLICT(term) DO NOTHING")
    int insertIgnore(SavedSearchRow row);

    @Delete("DELETE FROM saved_search WHERE term = #{term}")
    int deleteByTerm(@Param("term") String term);
}
