package com.findex.backend.service;

import com.findex.backend.config.ExportSettings;
import com.findex.backend.dto.ExportRequest;
import com.findex.backend.dto.ExportStartResponse;
import com.findex.backend.dto.ExportStatusResponse;
import com.findex.backend.exception.ConflictException;
import com.findex.backend.exception.InvalidSelectionException;
import com.findex.backend.exception.NotFoundException;
import com.findex.backend.exception.RemoteServiceException;
import com.findex.backend.model.FailurePolicy;
import com.findex.backend.model.Region;
import com.findex.backend.repository.ExportRunRepository;
import com.findex.backend.util.FakeGuardDutyPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class ExportRunServiceTest {

    @TempDir
    Path dir;

    private final RegionResolver regionResolver = mock(RegionResolver.class);
    private final List<Runnable> queued = new ArrayList<>();
    private final Executor queueingExecutor = queued::add;
    private FakeGuardDutyPort port;
    private ExportFileStore fileStore;
    private ExportRunRepository repository;
    private ExportRunService service;

    @BeforeEach
    void setup() {
        ExportSettings settings = ExportSettings.defaults(dir);
        port = new FakeGuardDutyPort()
                .detector("us-east-1", "d1", List.of("a", "b"))
                .detector("us-west-2", "d2", List.of("c"));
        fileStore = new ExportFileStore(settings, Clock.systemDefaultZone());
        repository = new ExportRunRepository();
        ExportAggregator aggregator = new ExportAggregator(new DetectorEnumerator(port),
                new FindingPaginator(port, settings), new FindingBatchResolver(port), new ExportRowMapper(),
                settings, Runnable::run);
        ExportRunExecutor runExecutor = new ExportRunExecutor(aggregator, fileStore);
        service = new ExportRunService(regionResolver, fileStore, repository, runExecutor, settings,
                queueingExecutor);
        when(regionResolver.listRegions(anyString(), any()))
                .thenReturn(List.of(Region.of("us-east-1"), Region.of("us-west-2"), Region.of("eu-west-1")));
    }

    @Test
    void emptySelectionFailsBeforeDiscovery() {
        assertThatThrownBy(() -> service.startRun(ExportRequest.builder().regions(List.of()).build()))
                .isInstanceOf(InvalidSelectionException.class);
        assertThatThrownBy(() -> service.runNow(new ExportRequest()))
                .isInstanceOf(InvalidSelectionException.class);

        verifyNoInteractions(regionResolver);
        assertThat(port.calls()).isEmpty();
        assertThat(queued).isEmpty();
    }

    @Test
    void unknownRegionsAreListed() {
        assertThatThrownBy(() -> service.validateSelection(List.of("us-east-1", "xx-1", "yy-2", "xx-1")))
                .isInstanceOfSatisfying(InvalidSelectionException.class,
                        ex -> assertThat(ex.getRejectedRegions()).containsExactly("xx-1", "yy-2"));
    }

    @Test
    void selectionKeepsOrderAndDuplicates() {
        assertThat(service.validateSelection(List.of("us-west-2", " us-east-1 ", "us-west-2")))
                .extracting(Region::name)
                .containsExactly("us-west-2", "us-east-1", "us-west-2");
    }

    @Test
    void selectionIsCheckedAgainstAllDiscoverableRegionsRegardlessOfPrefix() {
        assertThat(service.validateSelection(List.of("eu-west-1")))
                .extracting(Region::name)
                .containsExactly("eu-west-1");

        verify(regionResolver).listRegions(eq(""), any());
    }

    @Test
    void startedRunIsPendingUntilTheExecutorRunsIt() {
        ExportStartResponse started = service.startRun(ExportRequest.builder()
                .regions(List.of("us-east-1", "us-west-2")).build());

        assertThat(started.getStatus()).isEqualTo("PENDING");
        assertThat(queued).hasSize(1);
        assertThat(port.calls()).isEmpty();

        queued.get(0).run();

        ExportStatusResponse status = service.getStatus(started.getExportId());
        assertThat(status.getStatus()).isEqualTo("COMPLETED");
        assertThat(status.getTotalRows()).isEqualTo(3);
        assertThat(status.getRegionOutcomes()).hasSize(2);
        assertThat(status.getCompletedAt()).isNotNull();
        assertThat(service.artifact(started.getExportId())).exists();
    }

    @Test
    void cancellingPendingRunSkipsExecution() {
        ExportStartResponse started = service.startRun(ExportRequest.builder().regions(List.of("us-east-1")).build());

        ExportStatusResponse cancelled = service.cancel(started.getExportId());
        queued.get(0).run();

        assertThat(cancelled.getStatus()).isEqualTo("CANCELLED");
        assertThat(service.getStatus(started.getExportId()).getStatus()).isEqualTo("CANCELLED");
        assertThat(port.calls()).isEmpty();
        assertThatThrownBy(() -> service.cancel(started.getExportId())).isInstanceOf(ConflictException.class);
    }

    @Test
    void isolatePolicyFromRequestKeepsGoing() throws Exception {
        port.failListDetectors("us-east-1",
                new RemoteServiceException("ListDetectors", "us-east-1", "denied"));

        String fileName = service.runNow(ExportRequest.builder()
                .regions(List.of("us-east-1", "us-west-2"))
                .failurePolicy(FailurePolicy.ISOLATE)
                .build());

        assertThat(Files.readAllLines(dir.resolve(fileName))).hasSize(2);
    }

    @Test
    void unknownExportIsNotFound() {
        assertThatThrownBy(() -> service.getStatus("nope")).isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> service.artifact("nope")).isInstanceOf(NotFoundException.class);
    }

    @Test
    void runsAreListedNewestFirst() throws Exception {
        ExportStartResponse first = service.startRun(ExportRequest.builder().regions(List.of("us-east-1")).build());
        Thread.sleep(5);
        ExportStartResponse second = service.startRun(ExportRequest.builder().regions(List.of("us-west-2")).build());

        assertThat(service.listRuns()).extracting(ExportStatusResponse::getExportId)
                .containsExactly(second.getExportId(), first.getExportId());
    }
}
