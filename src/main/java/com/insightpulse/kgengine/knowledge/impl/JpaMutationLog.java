package com.insightpulse.kgengine.knowledge.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.insightpulse.kgengine.exception.StoreException;
import com.insightpulse.kgengine.knowledge.MutationLog;
import com.insightpulse.kgengine.model.audit.MutationLogEntry;
import com.insightpulse.kgengine.model.audit.MutationRecord;
import com.insightpulse.kgengine.model.audit.MutationStatus;
import com.insightpulse.kgengine.repository.MutationLogRepository;
import com.insightpulse.kgengine.util.ExternalCallLogger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class JpaMutationLog implements MutationLog {

    private static final int MAX_ERROR_LENGTH = 3900;

    private final MutationLogRepository repository;
    private final ObjectMapper objectMapper;

    @Override
    @Transactional
    public MutationLogEntry record(MutationRecord record) {
        return append(record);
    }

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public MutationLogEntry recordIsolated(MutationRecord record) {
        return append(record);
    }

    @Override
    @Transactional(readOnly = true)
    public List<MutationLogEntry> history(String target) {
        return repository.findByTargetOrderByIdAsc(target);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<MutationLogEntry> findEntry(Long id) {
        return repository.findById(id);
    }

    @Override
    @Transactional(readOnly = true)
    public List<MutationLogEntry> recent(int limit) {
        return repository.findAllByOrderByIdDesc(PageRequest.of(0, Math.max(1, limit)));
    }

    private MutationLogEntry append(MutationRecord record) {
        MutationLogEntry entry = MutationLogEntry.builder()
                .operation(record.getOperation())
                .target(record.getTarget())
                .source(record.getSource())
                .status(record.getStatus())
                .errorMessage(record.getErrorMessage() == null
                        ? null
                        : ExternalCallLogger.truncate(record.getErrorMessage(), MAX_ERROR_LENGTH))
                .payload(toJson(record.getPayload()))
                .build();

        MutationLogEntry saved = repository.save(entry);

        if (record.getStatus() == MutationStatus.FAILURE) {
            log.warn("Mutation {} on {} failed: {}", record.getOperation(), record.getTarget(), record.getErrorMessage());
        } else {
            log.debug("Mutation {} on {} recorded (entry {})", record.getOperation(), record.getTarget(), saved.getId());
        }
        return saved;
    }

    private String toJson(Object payload) {
        if (payload == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new StoreException("Mutation payload is not serializable", e);
        }
    }
}
