package com.jotter.note.mapper;

import com.jotter.note.domain.Note;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

@Mapper
public interface NoteMapper {

    /**
     * 列出用户的全部笔记，按创建时间倒序。
     * @param userId 笔记所属用户
     * @return 笔记列表
     */
    List<Note> listByUser(@Param("userId") Long userId);

    /**
     * 插入笔记，主键回填到 {@code note.id}。
     * @return 影响行数
     */
    int insert(Note note);

    /**
     * 删除属于该用户的笔记。
     * @return 影响行数（0 表示不存在或不属于该用户）
     */
    int deleteByIdAndUser(@Param("id") Long id, @Param("userId") Long userId);
}
