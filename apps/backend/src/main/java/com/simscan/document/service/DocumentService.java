package com.simscan.document.service;

import com.simscan.document.domain.CorpusDocument;

import java.util.List;

public interface DocumentService {

    /**
     * Records the metadata of a body that has already been written to the blob area.
     */
    CorpusDocument record(long userId, String storageKey, String fileName, byte[] body);

    List<CorpusDocument> listUserDocuments(long userId);

    List<CorpusDocument> listAll();
}
