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

import org.junit.jupiter.api.Test;
import se.devrandom.huginn.sei.SeiErrorClassifier.Classification;

import static org.assertj.core.api.Assertions.assertThat;

class SeiErrorClassifierTest {

    private final SeiErrorClassifier classifier = new SeiErrorClassifier();

    @Test
    void accessDeniedMessage() {
        String body = """
                {"detail": [{"loc": ["query"], "msg": "Unidade SEAD-PI/GAB não possui acesso ao processo 00002.000123/2024-11", "type": "value_error"}]}
                """;

        assertThat(classifier.classify(body)).isEqualTo(Classification.SCOPE_ACCESS_DENIED);
    }

    @Test
    void notFoundMessage() {
        String body = """
                {"detail": [{"msg": "Processo 00002.000123/2024-11 não encontrado"}]}
                """;

        assertThat(classifier.classify(body)).isEqualTo(Classification.NOT_FOUND);
    }

    @Test
    void accessDeniedWinsOverNotFound() {
        String body = """
                {"detail": [{"msg": "Documento não encontrado"}, {"msg": "User does not have access to process"}]}
                """;

        assertThat(classifier.classify(body)).isEqualTo(Classification.SCOPE_ACCESS_DENIED);
    }

    @Test
    void matchingIgnoresCase() {
        assertThat(classifier.classify("{\"detail\": [{\"msg\": \"Process NOT FOUND\"}]}"))
                .isEqualTo(Classification.NOT_FOUND);
    }

    @Test
    void otherBodiesAreUnclassified() {
        assertThat(classifier.classify("{\"detail\": [{\"msg\": \"Erro interno\"}]}")).isEqualTo(Classification.UNCLASSIFIED);
        assertThat(classifier.classify("<html>502 Bad Gateway</html>")).isEqualTo(Classification.UNCLASSIFIED);
        assertThat(classifier.classify("")).isEqualTo(Classification.UNCLASSIFIED);
        assertThat(classifier.classify(null)).isEqualTo(Classification.UNCLASSIFIED);
    }

    @Test
    void plainStringDetailIsAMessage() {
        assertThat(classifier.classify("{\"detail\": \"Processo não existe\"}")).isEqualTo(Classification.NOT_FOUND);
    }

    @Test
    void describeJoinsDetailMessages() {
        String body = "{\"detail\": [{\"msg\": \"first\"}, {\"msg\": \"second\"}]}";

        assertThat(classifier.describe(body)).isEqualTo("first; second");
        assertThat(classifier.describe("Service Unavailable")).isEqualTo("Service Unavailable");
    }

    @Test
    void configuredPatternsReplaceTheDefaults() {
        SeiErrorClassifier custom = new SeiErrorClassifier(
                new String[]{" Sem Permissão "}, new String[]{"inexistente"});

        assertThat(custom.classify("{\"detail\": [{\"msg\": \"Usuário sem permissão\"}]}"))
                .isEqualTo(Classification.SCOPE_ACCESS_DENIED);
        assertThat(custom.classify("{\"detail\": [{\"msg\": \"Processo inexistente\"}]}"))
                .isEqualTo(Classification.NOT_FOUND);
        assertThat(custom.classify("{\"detail\": [{\"msg\": \"não encontrado\"}]}"))
                .isEqualTo(Classification.UNCLASSIFIED);
    }
}
