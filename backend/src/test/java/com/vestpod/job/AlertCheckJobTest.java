package com.vestpod.job;

import com.vestpod.alert.AlertCheckOutcome;
import com.vestpod.alert.AlertEvaluator;
import com.vestpod.alert.AlertProperties;
import com.vestpod.domain.Alert;
import com.vestpod.domain.AlertRepository;
import com.vestpod.domain.AlertState;
import com.vestpod.domain.Asset;
import com.vestpod.domain.AssetRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.core.task.support.TaskExecutorAdapter;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyIterable;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AlertCheckJobTest {

    private static final Instant NOW = Instant.parse("2025-06-02T14:00:00Z");

    @Mock
    AlertRepository alertRepository;
    @Mock
    AssetRepository assetRepository;
    @Mock
    AlertEvaluator alertEvaluator;

    private AlertCheckJob job;

    @BeforeEach
    void setUp() {
        job = new AlertCheckJob(alertRepository, assetRepository, alertEvaluator, new AlertProperties(),
                new TaskExecutorAdapter(Runnable::run), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static Alert alert(String id, String ownerId, String assetId) {
        Alert alert = new Alert();
        alert.setId(id);
        alert.setOwnerId(ownerId);
        alert.setAssetId(assetId);
        return alert;
    }

    private static Asset asset(String id) {
        Asset asset = new Asset();
        asset.setId(id);
        return asset;
    }

    @Test
    @DisplayName("checks every active alert against its asset and totals the outcomes")
    void checksActiveAlerts() {
        Alert a1 = alert("al-1", "u1", "as-1");
        Alert a2 = alert("al-2", "u1", "as-2");
        Alert a3 = alert("al-3", "u2", "as-3");
        when(alertRepository.findByState(AlertState.ACTIVE)).thenReturn(List.of(a1, a2, a3));
        when(assetRepository.findAllById(anyIterable()))
                .thenReturn(List.of(asset("as-1"), asset("as-2")))
                .thenReturn(List.of(asset("as-3")));
        when(alertEvaluator.check(eq(a1), any())).thenReturn(AlertCheckOutcome.triggered("al-1", "reason", true));
        when(alertEvaluator.check(eq(a2), any())).thenReturn(AlertCheckOutcome.notTriggered("al-2"));
        when(alertEvaluator.check(eq(a3), any())).thenReturn(AlertCheckOutcome.triggered("al-3", "reason", false));

        RunSummary summary = job.run();

        assertThat(summary.job()).isEqualTo("alert-check");
        assertThat(summary.usersProcessed()).isEqualTo(2);
        assertThat(summary.alertsChecked()).isEqualTo(3);
        assertThat(summary.alertsTriggered()).isEqualTo(2);
        assertThat(summary.notificationsSent()).isEqualTo(1);
        assertThat(summary.errors()).isZero();
    }

    @Test
    @DisplayName("alert whose asset is gone is counted as an error and left untouched")
    void missingAsset() {
        Alert orphan = alert("al-1", "u1", "deleted");
        Alert ok = alert("al-2", "u1", "as-2");
        when(assetRepository.findAllById(anyIterable())).thenReturn(List.of(asset("as-2")));
        when(alertEvaluator.check(eq(ok), any())).thenReturn(AlertCheckOutcome.notTriggered("al-2"));

        AlertCheckJob.UserTally tally = job.checkUser("u1", List.of(orphan, ok));

        assertThat(tally.errors()).isEqualTo(1);
        assertThat(tally.checked()).isEqualTo(1);
        verify(alertEvaluator, never()).check(eq(orphan), any());
        assertThat(orphan.getLastCheckedAt()).isNull();
    }

    @Test
    @DisplayName("a failing alert does not stop the rest of the user's alerts")
    void alertFailureIsolated() {
        Alert broken = alert("al-1", "u1", "as-1");
        Alert ok = alert("al-2", "u1", "as-1");
        when(assetRepository.findAllById(anyIterable())).thenReturn(List.of(asset("as-1")));
        when(alertEvaluator.check(eq(broken), any())).thenThrow(new DataAccessResourceFailureException("write failed"));
        when(alertEvaluator.check(eq(ok), any())).thenReturn(AlertCheckOutcome.triggered("al-2", "reason", true));

        AlertCheckJob.UserTally tally = job.checkUser("u1", List.of(broken, ok));

        assertThat(tally).isEqualTo(new AlertCheckJob.UserTally(1, 1, 1, 1));
    }

    @Test
    @DisplayName("a user whose asset lookup fails is counted as failed; other users still run")
    void userFailureIsolated() {
        Alert a1 = alert("al-1", "u1", "as-1");
        Alert a2 = alert("al-2", "u2", "as-2");
        when(alertRepository.findByState(AlertState.ACTIVE)).thenReturn(List.of(a1, a2));
        when(assetRepository.findAllById(anyIterable()))
                .thenThrow(new DataAccessResourceFailureException("timeout"))
                .thenReturn(List.of(asset("as-2")));
        when(alertEvaluator.check(eq(a2), any())).thenReturn(AlertCheckOutcome.notTriggered("al-2"));

        RunSummary summary = job.run();

        assertThat(summary.usersFailed()).isEqualTo(1);
        assertThat(summary.usersProcessed()).isEqualTo(1);
        assertThat(summary.alertsChecked()).isEqualTo(1);
    }
}
