package io.drcontroller.api.handlers;

import io.drcontroller.api.models.responses.ApplicationDetailsResponse;
import io.drcontroller.api.models.responses.ErrorResponse;
import io.drcontroller.audit.AuditLog;
import io.drcontroller.catalog.ApplicationNotFoundException;
import io.drcontroller.enums.ReplicationDirection;
import io.drcontroller.models.ApplicationStatus;
import io.drcontroller.models.AuditRecord;
import io.drcontroller.orchestration.DrOrchestrator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.List;

import static io.drcontroller.models.TestApplications.application;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class ApplicationHandlerTest {

    @Mock
    private DrOrchestrator orchestrator;

    @Mock
    private AuditLog auditLog;

    @InjectMocks
    private ApplicationHandler applicationHandler;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
    }

    @Test
    void testGetOverview_Success() {
        // Given
        List<ApplicationStatus> statuses = List.of(
            ApplicationStatus.builder().application("APP1").direction(ReplicationDirection.PROD_TO_DR).build());
        when(orchestrator.statusAll()).thenReturn(statuses);

        // When
        ResponseEntity<Object> response = applicationHandler.getOverview();

        // Then
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody()).isEqualTo(statuses);
    }

    @Test
    void testGetOverview_Failure() {
        // Given
        when(orchestrator.statusAll()).thenThrow(new IllegalStateException("pool closed"));

        // When
        ResponseEntity<Object> response = applicationHandler.getOverview();

        // Then
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(((ErrorResponse) response.getBody()).getReason()).isEqualTo("pool closed");
    }

    @Test
    void testGetDetails_Success() {
        // Given
        when(orchestrator.getApplication("APP1")).thenReturn(application("APP1", "vol1"));

        // When
        ResponseEntity<Object> response = applicationHandler.getDetails("APP1");

        // Then
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        ApplicationDetailsResponse details = (ApplicationDetailsResponse) response.getBody();
        assertThat(details.getAppName()).isEqualTo("APP1");
        assertThat(details.getVolumes()).hasSize(1);
        assertThat(details.getVolumes().get(0).getSourcePath()).isEqualTo("prod_svm:vol1");
        assertThat(details.getVolumes().get(0).getDestinationPath()).isEqualTo("dr_svm:vol1");
        assertThat(details.getVolumes().get(0).getShareName()).isEqualTo("SHARE_vol1");
    }

    @Test
    void testGetDetails_NotFound() {
        // Given
        when(orchestrator.getApplication("NOPE")).thenThrow(new ApplicationNotFoundException("NOPE"));

        // When
        ResponseEntity<Object> response = applicationHandler.getDetails("NOPE");

        // Then
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(((ErrorResponse) response.getBody()).getReason()).isEqualTo("Application 'NOPE' not found");
    }

    @Test
    void testGetStatus_Success() {
        // Given
        ApplicationStatus status = ApplicationStatus.builder().application("APP1").build();
        when(orchestrator.status("APP1")).thenReturn(status);

        // When
        ResponseEntity<Object> response = applicationHandler.getStatus("APP1");

        // Then
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody()).isSameAs(status);
    }

    @Test
    void testGetAudit_DefaultLimit() {
        // Given
        List<AuditRecord> records = List.of(AuditRecord.builder().application("APP1").action("update").build());
        when(auditLog.readRecent("APP1", 20)).thenReturn(records);

        // When
        ResponseEntity<Object> response = applicationHandler.getAudit("APP1", null);

        // Then
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody()).isEqualTo(records);
        verify(orchestrator).getApplication("APP1");
    }

    @Test
    void testGetAudit_InvalidLimit() {
        // When
        ResponseEntity<Object> response = applicationHandler.getAudit("APP1", 0);

        // Then
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        verify(auditLog, never()).readRecent(anyString(), anyInt());
    }

    @Test
    void testGetAudit_UnknownApplication() {
        // Given
        when(orchestrator.getApplication("NOPE")).thenThrow(new ApplicationNotFoundException("NOPE"));

        // When
        ResponseEntity<Object> response = applicationHandler.getAudit("NOPE", 5);

        // Then
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        verifyNoInteractions(auditLog);
    }
}
