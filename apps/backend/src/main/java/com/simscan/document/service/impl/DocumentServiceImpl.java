package com.simscan.document.service.impl;

import com.simscan.document.domain.CorpusDocument;
import com.simscan.document.service.DocumentService;
import com.simscan.mapper.DocumentMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.digest.DigestUtils;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class DocumentServiceImpl implements DocumentService {

    private final DocumentMapper documentMapper;
    private final Clock clock;

    @Override
    public CorpusDocument record(long userId, String storageKey, String fileName, byte[] body) {
        CorpusDocument doc = CorpusDocument.builder()
                .userId(userId)
                .storageKey(storageKey)
                .fileName(fileName)
                .sizeBytes((long) body.length)
                .sha256(DigestUtils.sha256Hex(body))
                .createdAt(LocalDateTime.now(clock))
                .build();

        documentMapper.insert(doc);
        log.debug("Recorded document id={} user={} key={} bytes={}",
                doc.getId(), userId, storageKey, body.length);
        return doc;
    }

    @Override
    public List<CorpusDocument> listUserDocuments(long userId) {
        return documentMapper.selectByUser(userId);
    }

    @Override
    public List<CorpusDocument> listAll() {
        return documentMapper.selectAll();
    }
}
