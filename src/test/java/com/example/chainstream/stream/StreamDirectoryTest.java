package com.example.chainstream.stream;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StreamDirectoryTest {

    private final StreamDirectory directory = new StreamDirectory(false);

    @Test
    void knownNames_resolveToTheirSubjects() {
        assertThat(directory.resolve("blocks")).isEqualTo("eth.blocks.full");
        assertThat(directory.resolve("blocks-simple")).isEqualTo("eth.blocks");
        assertThat(directory.resolve("pending")).isEqualTo("eth.pending");
        assertThat(directory.resolve("logs")).isEqualTo("eth.logs");
        assertThat(directory.resolve("network")).isEqualTo("eth.network");
        assertThat(directory.resolve("gasPrice")).isEqualTo("eth.gasPrice");
    }

    @Test
    void gasAlias_resolvesLikeGasPrice() {
        assertThat(directory.resolve("gas")).isEqualTo(directory.resolve("gasPrice"));
    }

    @Test
    void unknownName_fallsBackToFullBlocks() {
        assertThat(directory.resolve("does-not-exist")).isEqualTo(StreamDirectory.DEFAULT_SUBJECT);
        assertThat(directory.resolve("Blocks")).isEqualTo("eth.blocks.full");
    }

    @Test
    void unknownName_rejectedWhenConfigured() {
        StreamDirectory strict = new StreamDirectory(true);

        assertThat(strict.resolve("gas")).isEqualTo("eth.gasPrice");
        assertThatThrownBy(() -> strict.resolve("does-not-exist"))
                .isInstanceOf(UnknownStreamException.class)
                .hasMessageContaining("does-not-exist");
    }

    @Test
    void describe_listsEveryStreamButNotAliases() {
        Map<String, String> streams = directory.describe();

        assertThat(streams).containsOnlyKeys("blocks", "pending", "logs", "network", "gasPrice", "blocks-simple");
        assertThat(streams.get("blocks")).startsWith("eth.blocks.full - ");
        assertThat(streams.get("gasPrice")).startsWith("eth.gasPrice - ");
    }

    @Test
    void everyListedStream_mapsToAProvisionedSubject() {
        for (String name : directory.describe().keySet()) {
            assertThat(Subjects.ALL).contains(directory.resolve(name));
        }
    }
}
