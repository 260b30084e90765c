package com.tyron.multicode.core.meta;

import com.tyron.multicode.api.meta.MetadataRecord;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.tyron.multicode.testFramework.TestRecords.builder;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MetadataQueryTest {

    private final MetadataRecord parser = builder("parser", 0, 0).tag("core").tag("syntax").build();
    private final MetadataRecord socket = builder("socket", 0, 1).tag("net").link("parser").origin("generated").build();
    private final MetadataRecord button = builder("button", 1, 0).tag("ui").build();

    private final List<MetadataRecord> all = List.of(parser, socket, button);

    private List<String> ids(String query) {
        return MetadataQuery.parse(query).filter(all).stream().map(MetadataRecord::getId).toList();
    }

    @Test
    void fieldTermMatchesBySubstring() {
        assertEquals(List.of("socket"), ids("id:sock"));
        assertEquals(List.of("parser"), ids("tags:syn"));
        assertEquals(List.of(), ids("id:Sock"));
    }

    @Test
    void orBindsLooserThanAnd() {
        assertEquals(List.of("parser", "button"), ids("tags:core AND id:parser OR tags:ui"));
        assertEquals(List.of("socket", "button"), ids("tags:net or tags:ui"));
    }

    @Test
    void adjacentTermsAreJoinedWithAnd() {
        assertEquals(List.of("socket"), ids("tags:net origin:gen"));
        assertEquals(List.of(), ids("tags:net tags:ui"));
    }

    @Test
    void bareWordSearchesEveryField() {
        // "parser" is the id of one record and a link of another
        assertEquals(List.of("parser", "socket"), ids("parser"));
    }

    @Test
    void missingFieldNeverMatches() {
        assertEquals(List.of(), ids("extends:x"));
        assertFalse(MetadataQuery.parse("color:red").matches(button));
    }

    @Test
    void emptyQueryMatchesEverything() {
        assertEquals(3, ids("").size());
        assertEquals(3, ids("   ").size());
        assertTrue(MetadataQuery.parse("id:button AND").matches(button));
    }

    @Test
    void storeQueriesRecordsOfAText() {
        MetadataStore store = new MetadataStore();
        String text = "// @VISUAL_META {\"id\":\"a\",\"x\":0,\"y\":0,\"tags\":[\"ui\"]}\n"
                + "fn a() {}\n"
                + "// @VISUAL_META {\"id\":\"b\",\"x\":0,\"y\":0,\"tags\":[\"net\"]}\n"
                + "fn b() {}\n";

        List<MetadataRecord> matching = store.query(text, MetadataQuery.parse("tags:net"));

        assertEquals(1, matching.size());
        assertEquals("b", matching.get(0).getId());
    }
}
