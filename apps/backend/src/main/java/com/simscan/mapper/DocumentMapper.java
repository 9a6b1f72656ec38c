package com.simscan.mapper;

import com.simscan.document.domain.CorpusDocument;
import com.simscan.mapper.model.UserScanCount;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

@Mapper
public interface DocumentMapper {

    int insert(CorpusDocument document);

    CorpusDocument selectById(@Param("id") long id);

    /** Whole corpus minus one key, ordered by id. */
    List<CorpusDocument> selectAllExcept(@Param("storageKey") String storageKey);

    List<CorpusDocument> selectByUser(@Param("userId") long userId);

    List<CorpusDocument> selectAll();

    long countAll();

    List<UserScanCount> selectScanCountsByUser();
}
