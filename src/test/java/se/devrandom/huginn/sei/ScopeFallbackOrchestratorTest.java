/*
 * Huginn - SEI Process Synchronization
 * Copyright (C) 2025 Johan Karlsteen
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 */
package se.devrandom.huginn.sei;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import se.devrandom.huginn.sei.objects.DocumentRecord;
import se.devrandom.huginn.sei.objects.ProcessRecord;
import se.devrandom.huginn.sei.objects.ProgressionRecord;
import se.devrandom.huginn.sei.objects.ScopeEntry;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class ScopeFallbackOrchestratorTest {

    private static final String PROTOCOL = "00002.000123/2024-11";

    private SeiApiClient apiClient;
    private ScopeDirectory scopeDirectory;
    private ScopeFallbackOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        apiClient = mock(SeiApiClient.class);
        scopeDirectory = new ScopeDirectory();
        CredentialManager credentialManager = new CredentialManager(() -> CredentialManagerTest.loginResponse("t",
                "SEAD-PI", "1",
                "SEAD-PI/GAB", "2",
                "SEAD-PI/GAB/NTI", "3",
                "SEAD-PI/DRH", "4",
                "SEDUC-PI", "9",
                "SEMAR-PI", "20",
                "SEMAR-PI/GAB", "21"), scopeDirectory);
        orchestrator = new ScopeFallbackOrchestrator(apiClient, scopeDirectory, credentialManager);

        when(apiClient.consultProcess(anyString(), anyString()))
                .thenReturn(FetchOutcome.accessDenied("Unidade não possui acesso ao processo"));
        when(apiClient.listDocuments(anyString(), anyString()))
                .thenReturn(FetchOutcome.success(List.of(document(501), document(502))));
        when(apiClient.listProgressions(anyString(), anyString()))
                .thenReturn(FetchOutcome.success(List.of(progression(9001))));
    }

    @AfterEach
    void tearDown() {
        orchestrator.shutdown();
    }

    static ProcessRecord process(String protocol) {
        ObjectNode node = JsonNodeFactory.instance.objectNode()
                .put("IdProcedimento", "777")
                .put("Especificacao", "Aquisição de material");
        return ProcessRecord.fromApi(protocol, node);
    }

    static DocumentRecord document(long id) {
        return DocumentRecord.fromApi(JsonNodeFactory.instance.objectNode().put("IdDocumento", String.valueOf(id)));
    }

    static ProgressionRecord progression(long id) {
        return ProgressionRecord.fromApi(JsonNodeFactory.instance.objectNode().put("IdAndamento", String.valueOf(id)));
    }

    @Test
    void declaredUnitWithAccessSucceedsDirectly() {
        when(apiClient.consultProcess("2", PROTOCOL)).thenReturn(FetchOutcome.success(process(PROTOCOL)));

        ProcessFetchResult result = orchestrator.fetchProcess(PROTOCOL, "SEAD-PI/GAB");

        assertThat(result.status()).isEqualTo(ProcessFetchResult.Status.SUCCESS);
        assertThat(result.scopeName()).isEqualTo("SEAD-PI/GAB");
        assertThat(result.scopeId()).isEqualTo("2");
        assertThat(result.triedScopes()).containsExactly("SEAD-PI/GAB");
        assertThat(result.process().procedureId()).isEqualTo(777L);
        assertThat(result.documents()).extracting(DocumentRecord::documentId).containsExactly(501L, 502L);
        assertThat(result.progressions()).hasSize(1);
        verify(apiClient).listDocuments("2", PROTOCOL);
        verify(apiClient).listProgressions("2", PROTOCOL);
    }

    @Test
    void deniedUnitFallsBackToMoreSpecificSiblingsFirst() {
        when(apiClient.consultProcess("2", PROTOCOL)).thenReturn(FetchOutcome.success(process(PROTOCOL)));

        ProcessFetchResult result = orchestrator.fetchProcess(PROTOCOL, "SEAD-PI/DRH");

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.scopeName()).isEqualTo("SEAD-PI/GAB");
        assertThat(result.triedScopes()).containsExactly("SEAD-PI/DRH", "SEAD-PI/GAB/NTI", "SEAD-PI/GAB");
        verify(apiClient, never()).consultProcess("1", PROTOCOL);
        verify(apiClient, never()).consultProcess("9", PROTOCOL);
    }

    @Test
    void candidatesAreDeclaredUnitThenTenantUnitsWithoutDuplicates() {
        List<ScopeEntry> candidates = orchestrator.candidates(new ScopeEntry("SEAD-PI/GAB", "2"));

        assertThat(candidates).extracting(ScopeEntry::name)
                .containsExactly("SEAD-PI/GAB", "SEAD-PI/GAB/NTI", "SEAD-PI/DRH", "SEAD-PI");
    }

    @Test
    void notFoundStopsTheSearch() {
        when(apiClient.consultProcess("3", PROTOCOL)).thenReturn(FetchOutcome.fatal("Processo não encontrado"));

        ProcessFetchResult result = orchestrator.fetchProcess(PROTOCOL, "SEAD-PI/DRH");

        assertThat(result.status()).isEqualTo(ProcessFetchResult.Status.NOT_FOUND);
        assertThat(result.message()).isEqualTo("Processo não encontrado");
        verify(apiClient, never()).consultProcess("2", PROTOCOL);
        verify(apiClient, never()).consultProcess("1", PROTOCOL);
        verify(apiClient, never()).listDocuments(anyString(), anyString());
    }

    @Test
    void everyUnitDeniedIsAccessDeniedWithTheUnitsTried() {
        ProcessFetchResult result = orchestrator.fetchProcess(PROTOCOL, "SEDUC-PI");

        assertThat(result.status()).isEqualTo(ProcessFetchResult.Status.ACCESS_DENIED);
        assertThat(result.triedScopes()).containsExactly("SEDUC-PI");
        assertThat(result.message()).isEqualTo("None of the 1 units had access. Units tried: SEDUC-PI");
    }

    @Test
    void twoUnitTenantDeniedEverywhereReportsBothUnits() {
        ProcessFetchResult result = orchestrator.fetchProcess(PROTOCOL, "SEMAR-PI/GAB");

        assertThat(result.status()).isEqualTo(ProcessFetchResult.Status.ACCESS_DENIED);
        assertThat(result.triedScopes()).hasSize(2).containsExactly("SEMAR-PI/GAB", "SEMAR-PI");
        assertThat(result.message()).isEqualTo("None of the 2 units had access. Units tried: SEMAR-PI/GAB, SEMAR-PI");
        verify(apiClient).consultProcess("21", PROTOCOL);
        verify(apiClient).consultProcess("20", PROTOCOL);
        verify(apiClient, never()).consultProcess("1", PROTOCOL);
    }

    @Test
    void unitUnknownToTheUserIsAccessDeniedWithoutCallingSei() {
        ProcessFetchResult result = orchestrator.fetchProcess(PROTOCOL, "SEFAZ-PI/GAB");

        assertThat(result.status()).isEqualTo(ProcessFetchResult.Status.ACCESS_DENIED);
        assertThat(result.triedScopes()).isEmpty();
        verify(apiClient, never()).consultProcess(anyString(), anyString());
    }

    @Test
    void prefixResolvedUnitIsTriedUnderItsResolvedId() {
        when(apiClient.consultProcess("3", PROTOCOL)).thenReturn(FetchOutcome.success(process(PROTOCOL)));

        ProcessFetchResult result = orchestrator.fetchProcess(PROTOCOL, "SEAD-PI/GAB/NTI/SUPORTE");

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.scopeId()).isEqualTo("3");
        assertThat(result.scopeName()).isEqualTo("SEAD-PI/GAB/NTI");
        assertThat(result.triedScopes()).containsExactly("SEAD-PI/GAB/NTI");
    }

    @Test
    void prefixResolvedUnitIsReportedUnderTheQueriedName() {
        ProcessFetchResult result = orchestrator.fetchProcess(PROTOCOL, "SEAD-PI/GAB/NTI/SUPORTE");

        assertThat(result.status()).isEqualTo(ProcessFetchResult.Status.ACCESS_DENIED);
        assertThat(result.triedScopes()).containsExactly("SEAD-PI/GAB/NTI", "SEAD-PI/GAB", "SEAD-PI/DRH", "SEAD-PI");
        assertThat(result.triedScopes()).doesNotContain("SEAD-PI/GAB/NTI/SUPORTE");
    }

    @Test
    void transientFailureIsAnError() {
        when(apiClient.consultProcess("4", PROTOCOL)).thenReturn(FetchOutcome.transientError("HTTP 503: Service Unavailable"));

        ProcessFetchResult result = orchestrator.fetchProcess(PROTOCOL, "SEAD-PI/DRH");

        assertThat(result.status()).isEqualTo(ProcessFetchResult.Status.ERROR);
        assertThat(result.message()).contains("503");
        verify(apiClient, never()).consultProcess(eq("3"), anyString());
    }

    @Test
    void unexpectedExceptionIsAnError() {
        when(apiClient.consultProcess("4", PROTOCOL)).thenThrow(new IllegalStateException("SEI returned a body that is not JSON"));

        ProcessFetchResult result = orchestrator.fetchProcess(PROTOCOL, "SEAD-PI/DRH");

        assertThat(result.status()).isEqualTo(ProcessFetchResult.Status.ERROR);
        assertThat(result.message()).contains("not JSON");
    }

    @Test
    void subFetchFailuresDegradeToEmptyLists() {
        when(apiClient.consultProcess("2", PROTOCOL)).thenReturn(FetchOutcome.success(process(PROTOCOL)));
        when(apiClient.listDocuments("2", PROTOCOL)).thenReturn(FetchOutcome.transientError("timeout"));
        when(apiClient.listProgressions("2", PROTOCOL)).thenThrow(new IllegalStateException("broken page"));

        ProcessFetchResult result = orchestrator.fetchProcess(PROTOCOL, "SEAD-PI/GAB");

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.documents()).isEmpty();
        assertThat(result.progressions()).isEmpty();
    }

    @Test
    void authenticationFailureIsNotARecordOutcome() {
        when(apiClient.consultProcess("2", PROTOCOL)).thenThrow(new SeiAuthenticationException("login failed"));

        assertThatThrownBy(() -> orchestrator.fetchProcess(PROTOCOL, "SEAD-PI/GAB"))
                .isInstanceOf(SeiAuthenticationException.class);
    }

    @Test
    void loginFailureBeforeResolutionPropagates() {
        CredentialManager failing = new CredentialManager(() -> {
            throw new SeiAuthenticationException("bad password");
        }, new ScopeDirectory());
        ScopeFallbackOrchestrator broken = new ScopeFallbackOrchestrator(apiClient, new ScopeDirectory(), failing);
        try {
            assertThatThrownBy(() -> broken.fetchProcess(PROTOCOL, "SEAD-PI")).isInstanceOf(SeiAuthenticationException.class);
            verifyNoInteractions(apiClient);
        } finally {
            broken.shutdown();
        }
    }
}
