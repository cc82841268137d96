package com.mtsa.findings.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mtsa.findings.dto.RevalidationReport;
import com.mtsa.findings.model.AnalysisSection;
import com.mtsa.findings.model.AnalysisType;
import com.mtsa.findings.model.CombinationKey;
import com.mtsa.findings.model.FindingsCandidate;
import com.mtsa.findings.model.FindingsFilter;
import com.mtsa.findings.model.FindingsHistory;
import com.mtsa.findings.model.FindingsRecord;
import com.mtsa.findings.model.HistoryChangeType;
import com.mtsa.findings.model.ValidationIssue;
import com.mtsa.findings.model.ValidationResult;
import com.mtsa.findings.model.ValidationStatus;
import com.mtsa.findings.repository.FindingsHistoryRepository;
import com.mtsa.findings.repository.FindingsRecordRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.transaction.support.TransactionOperations;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static com.mtsa.findings.service.FindingsFixtures.text;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class FindingsStoreTest {

    private static final ValidationResult VALID = new ValidationResult(ValidationStatus.VALID, List.of());

    @Mock
    private FindingsRecordRepository repository;

    @Mock
    private FindingsHistoryRepository historyRepository;

    private FindingsStore store;
    private CombinationKey single;
    private CombinationKey multi;

    @BeforeEach
    void setUp() {
        store = new FindingsStore(repository, historyRepository, FindingsFixtures.validator(),
                TransactionOperations.withoutTransaction());
        CombinationKeyFactory keys = new CombinationKeyFactory(CombinationCatalog.defaults(), new ObjectMapper());
        single = keys.canonicalize("Benchmarking", List.of("Google Trends"), "es");
        multi = keys.canonicalize("Benchmarking", List.of("Google Trends", "Crossref"), "es");
    }

    @Test
    void putStoresNewSingleSourceRecordWithoutCrossSourceColumns() {
        when(repository.findByCombinationHash(single.hash())).thenReturn(Optional.empty());
        when(repository.saveAndFlush(any(FindingsRecord.class))).thenAnswer(invocation -> invocation.getArgument(0));

        FindingsRecord saved = store.put(FindingsFixtures.singleCandidate(single, 2), VALID);

        assertThat(saved.getCombinationHash()).isEqualTo(single.hash());
        assertThat(saved.getCanonicalKey()).isEqualTo(single.canonicalForm());
        assertThat(saved.getAnalysisType()).isEqualTo(AnalysisType.SINGLE);
        assertThat(saved.getCorrelationAnalysis()).isNull();
        assertThat(saved.getComponentAnalysis()).isNull();
        assertThat(saved.isActive()).isTrue();
        assertThat(saved.getSchemaVersion()).isEqualTo(2);
        assertThat(saved.getValidationStatus()).isEqualTo(ValidationStatus.VALID);
    }

    @Test
    void putWithSameSchemaVersionOverLiveRecordIsStale() {
        FindingsRecord live = record(multi, 2, true, ValidationStatus.VALID);
        when(repository.findByCombinationHash(multi.hash())).thenReturn(Optional.of(live));

        assertThatThrownBy(() -> store.put(FindingsFixtures.multiCandidate(multi, 2), VALID))
                .isInstanceOf(StaleWriteException.class);
        verify(repository, never()).saveAndFlush(any());
    }

    @Test
    void putWithNewerSchemaVersionSupersedesInPlace() {
        FindingsRecord live = record(multi, 1, true, ValidationStatus.PARTIAL);
        when(repository.findByCombinationHash(multi.hash())).thenReturn(Optional.of(live));
        when(repository.saveAndFlush(any(FindingsRecord.class))).thenAnswer(invocation -> invocation.getArgument(0));

        FindingsRecord saved = store.put(FindingsFixtures.multiCandidate(multi, 2), VALID);

        assertThat(saved).isSameAs(live);
        assertThat(saved.getSchemaVersion()).isEqualTo(2);
        assertThat(saved.getValidationStatus()).isEqualTo(ValidationStatus.VALID);
        assertThat(saved.getCorrelationAnalysis()).isNotBlank();
    }

    @Test
    void replacingAtSameSchemaVersionOverwritesLiveRecordAndKeepsPreviousContent() {
        FindingsRecord live = record(multi, 2, true, ValidationStatus.VALID);
        live.setExecutiveSummary("previous summary text");
        when(repository.findByCombinationHash(multi.hash())).thenReturn(Optional.of(live));
        when(repository.saveAndFlush(any(FindingsRecord.class))).thenAnswer(invocation -> invocation.getArgument(0));
        ArgumentCaptor<FindingsHistory> history = ArgumentCaptor.forClass(FindingsHistory.class);

        FindingsRecord saved = store.put(FindingsFixtures.multiCandidate(multi, 2), VALID, true);

        assertThat(saved.isServable()).isTrue();
        assertThat(saved.getExecutiveSummary()).isNotEqualTo("previous summary text");
        verify(historyRepository).save(history.capture());
        assertThat(history.getValue().getChangeType()).isEqualTo(HistoryChangeType.REFRESHED);
        assertThat(history.getValue().getRecordId()).isEqualTo(live.getId());
        assertThat(history.getValue().getPreviousSections()).containsEntry("executive_summary", "previous summary text");
    }

    @Test
    void replacingNeverOverwritesANewerSchemaVersion() {
        FindingsRecord live = record(single, 3, true, ValidationStatus.VALID);
        when(repository.findByCombinationHash(single.hash())).thenReturn(Optional.of(live));

        assertThatThrownBy(() -> store.put(FindingsFixtures.singleCandidate(single, 2), VALID, true))
                .isInstanceOf(StaleWriteException.class);
        verify(repository, never()).saveAndFlush(any());
        verifyNoInteractions(historyRepository);
    }

    @Test
    void invalidatedRecordIsNeverDowngradedToAnOlderSchemaVersion() {
        FindingsRecord invalidated = record(single, 3, false, ValidationStatus.VALID);
        invalidated.setInvalidationReason("manual");
        when(repository.findByCombinationHash(single.hash())).thenReturn(Optional.of(invalidated));

        assertThatThrownBy(() -> store.put(FindingsFixtures.singleCandidate(single, 1), VALID))
                .isInstanceOf(StaleWriteException.class);
        assertThat(invalidated.getSchemaVersion()).isEqualTo(3);
        verify(repository, never()).saveAndFlush(any());
    }

    @Test
    void invalidRecordIsNeverDowngradedEither() {
        FindingsRecord rejected = record(single, 3, false, ValidationStatus.INVALID);
        when(repository.findByCombinationHash(single.hash())).thenReturn(Optional.of(rejected));
        ValidationResult invalid = new ValidationResult(ValidationStatus.INVALID, List.of(ValidationIssue.NO_DATA_POINTS));

        assertThatThrownBy(() -> store.put(FindingsFixtures.singleCandidate(single, 2), VALID))
                .isInstanceOf(StaleWriteException.class);
        assertThat(store.retainForDiagnostics(FindingsFixtures.singleCandidate(single, 2), invalid)).isEmpty();
        verify(repository, never()).saveAndFlush(any());
    }

    @Test
    void putOverInvalidatedRecordIsAllowed() {
        FindingsRecord inactive = record(single, 2, false, ValidationStatus.VALID);
        inactive.setInvalidationReason("forced refresh");
        when(repository.findByCombinationHash(single.hash())).thenReturn(Optional.of(inactive));
        when(repository.saveAndFlush(any(FindingsRecord.class))).thenAnswer(invocation -> invocation.getArgument(0));

        FindingsRecord saved = store.put(FindingsFixtures.singleCandidate(single, 2), VALID);

        assertThat(saved.isActive()).isTrue();
        assertThat(saved.getInvalidationReason()).isNull();
        verify(historyRepository).save(argThat(entry -> entry.getChangeType() == HistoryChangeType.SUPERSEDED
                && entry.getChangeReason().contains("forced refresh")));
    }

    @Test
    void invalidCandidateIsNeverStoredAsLive() {
        ValidationResult invalid = new ValidationResult(ValidationStatus.INVALID, List.of(ValidationIssue.UNKNOWN_GENERATOR));

        assertThatThrownBy(() -> store.put(FindingsFixtures.singleCandidate(single, 2), invalid))
                .isInstanceOf(SchemaViolationException.class);
        verifyNoInteractions(repository);
    }

    @Test
    void contentShapeMustMatchCombination() {
        FindingsCandidate multiContentOnSingleKey = new FindingsCandidate(single,
                FindingsFixtures.multiCandidate(multi, 2).content(),
                FindingsFixtures.multiCandidate(multi, 2).metadata(), Map.of(), 2);

        assertThatThrownBy(() -> store.put(multiContentOnSingleKey, VALID))
                .isInstanceOf(SchemaViolationException.class);
        verifyNoInteractions(repository);
    }

    @Test
    void singleSourceWithStrayCrossSourceTextIsRejected() {
        FindingsCandidate base = FindingsFixtures.singleCandidate(single, 2);
        FindingsCandidate stray = new FindingsCandidate(single, base.content(), base.metadata(),
                Map.of(AnalysisSection.COMPONENT_ANALYSIS, text("Component", 300)), 2);

        assertThatThrownBy(() -> store.put(stray, VALID)).isInstanceOf(SchemaViolationException.class);
    }

    @Test
    void lostOptimisticRaceIsReportedAsStaleWrite() {
        when(repository.findByCombinationHash(single.hash())).thenReturn(Optional.empty());
        when(repository.saveAndFlush(any(FindingsRecord.class))).thenThrow(new OptimisticLockingFailureException("row changed"));

        assertThatThrownBy(() -> store.put(FindingsFixtures.singleCandidate(single, 2), VALID))
                .isInstanceOf(StaleWriteException.class);
    }

    @Test
    void invalidateUnknownHashFails() {
        when(repository.findByCombinationHash("missing")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> store.invalidate("missing", "manual"))
                .isInstanceOf(FindingsNotFoundException.class);
    }

    @Test
    void invalidateIsSoft() {
        FindingsRecord live = record(single, 2, true, ValidationStatus.VALID);
        when(repository.findByCombinationHash(single.hash())).thenReturn(Optional.of(live));
        when(repository.saveAndFlush(any(FindingsRecord.class))).thenAnswer(invocation -> invocation.getArgument(0));

        FindingsRecord invalidated = store.invalidate(single.hash(), "manual");

        assertThat(invalidated.isActive()).isFalse();
        assertThat(invalidated.getInvalidationReason()).isEqualTo("manual");
        verify(repository, never()).delete(any());
        verify(historyRepository).save(argThat(entry -> entry.getChangeType() == HistoryChangeType.INVALIDATED
                && "manual".equals(entry.getChangeReason())));
    }

    @Test
    void feedbackRatingMustBeBetweenOneAndFive() {
        assertThatThrownBy(() -> store.recordFeedback(single.hash(), 6, "great"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> store.recordFeedback(single.hash(), 0, null))
                .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(repository);
    }

    @Test
    void revalidationDeactivatesRecordsThatNoLongerPass() {
        FindingsRecord good = record(single, 2, true, ValidationStatus.VALID);
        FindingsRecord bad = record(multi, 2, true, ValidationStatus.VALID);
        bad.setGeneratorId("unknown");
        when(repository.findActive(null, null, null)).thenReturn(List.of(good, bad));
        when(repository.findByCombinationHash(single.hash())).thenReturn(Optional.of(good));
        when(repository.findByCombinationHash(multi.hash())).thenReturn(Optional.of(bad));
        when(repository.saveAndFlush(any(FindingsRecord.class))).thenAnswer(invocation -> invocation.getArgument(0));

        RevalidationReport report = store.revalidate(FindingsFilter.all());

        assertThat(report.checked()).isEqualTo(2);
        assertThat(report.valid()).isEqualTo(1);
        assertThat(report.invalidated()).isEqualTo(1);
        assertThat(bad.isActive()).isFalse();
        assertThat(bad.getValidationIssues()).contains("UNKNOWN_GENERATOR");
        assertThat(good.isActive()).isTrue();
    }

    @Test
    void retainForDiagnosticsKeepsInvalidOutputInactive() {
        when(repository.findByCombinationHash(single.hash())).thenReturn(Optional.empty());
        ArgumentCaptor<FindingsRecord> captor = ArgumentCaptor.forClass(FindingsRecord.class);
        when(repository.saveAndFlush(captor.capture())).thenAnswer(invocation -> invocation.getArgument(0));
        ValidationResult invalid = new ValidationResult(ValidationStatus.INVALID, List.of(ValidationIssue.NO_DATA_POINTS));

        Optional<FindingsRecord> retained = store.retainForDiagnostics(FindingsFixtures.singleCandidate(single, 2), invalid);

        assertThat(retained).isPresent();
        assertThat(captor.getValue().isActive()).isFalse();
        assertThat(captor.getValue().isServable()).isFalse();
        assertThat(captor.getValue().getInvalidationReason()).contains("NO_DATA_POINTS");
    }

    private FindingsRecord record(CombinationKey key, int schemaVersion, boolean active, ValidationStatus status) {
        FindingsCandidate candidate = key.analysisType() == AnalysisType.SINGLE
                ? FindingsFixtures.singleCandidate(key, schemaVersion)
                : FindingsFixtures.multiCandidate(key, schemaVersion);
        FindingsRecord record = new FindingsRecord();
        record.setId(UUID.randomUUID());
        record.setCombinationHash(key.hash());
        record.setCanonicalKey(key.canonicalForm());
        record.setToolName(key.tool());
        record.setSourceIds(key.sources());
        record.setLanguage(key.language());
        record.setAnalysisType(key.analysisType());
        record.setExecutiveSummary(candidate.content().executiveSummary());
        record.setPrincipalFindings(candidate.content().principalFindings());
        record.setStrategicSynthesis(candidate.content().strategicSynthesis());
        record.setConclusions(candidate.content().conclusions());
        if (key.analysisType() == AnalysisType.MULTI) {
            record.setCorrelationAnalysis(text("Correlation", 400));
            record.setComponentAnalysis(text("Component", 400));
        }
        record.setGeneratorId(candidate.metadata().generatorId());
        record.setDataPoints(candidate.metadata().dataPoints());
        record.setValidationStatus(status);
        record.setSchemaVersion(schemaVersion);
        record.setActive(active);
        return record;
    }
}
