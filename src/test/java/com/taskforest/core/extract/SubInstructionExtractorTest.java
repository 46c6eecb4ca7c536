package com.taskforest.core.extract;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SubInstructionExtractorTest {

    private SubInstructionExtractor extractor;

    @BeforeEach
    void setUp() {
        extractor = new SubInstructionExtractor();
    }

    @Nested
    @DisplayName("no structure")
    class NoStructure {

        @Test
        @DisplayName("null and blank input yield nothing")
        void nullAndBlank() {
            assertTrue(extractor.extract(null).isEmpty());
            assertTrue(extractor.extract("   \n ").isEmpty());
        }

        @Test
        @DisplayName("pure prose yields nothing")
        void pureProse() {
            String prose = "I looked at the code and I think the approach is fine. "
                    + "We should probably revisit the caching later, but nothing needs doing now.";
            assertTrue(extractor.extract(prose).isEmpty());
        }
    }

    @Nested
    @DisplayName("line patterns")
    class LinePatterns {

        @Test
        @DisplayName("bullets keep source order")
        void bullets() {
            String text = "Plan:\n- build module X\n* write tests for X\n+ update the changelog\n";
            assertEquals(List.of("build module X", "write tests for X", "update the changelog"),
                    extractor.extract(text));
        }

        @Test
        @DisplayName("numbered items with dot or parenthesis")
        void numbered() {
            String text = "1. create the schema\n2) seed the database";
            assertEquals(List.of("create the schema", "seed the database"), extractor.extract(text));
        }

        @Test
        @DisplayName("headings and block quotes")
        void headingsAndQuotes() {
            assertEquals(List.of("Setup the database"), extractor.extract("## Setup the database ##"));
            assertEquals(List.of("please refactor the parser"), extractor.extract("> please refactor the parser"));
        }

        @Test
        @DisplayName("items shorter than the minimum are dropped")
        void shortItemsDropped() {
            assertEquals(List.of("valid item"), extractor.extract("- ok\n- valid item"));
        }

        @Test
        @DisplayName("N declared bullets come back as N instructions in order")
        void roundTrip() {
            var expected = new ArrayList<String>();
            var text = new StringBuilder("Tasks for today:\n");
            for (int i = 1; i <= 25; i++) {
                String item = "handle work item number " + i;
                expected.add(item);
                text.append("- ").append(item).append('\n');
            }
            assertEquals(expected, extractor.extract(text.toString()));
        }
    }

    @Nested
    @DisplayName("fenced code")
    class FencedCode {

        @Test
        @DisplayName("language-tagged fence is emitted as language: code")
        void taggedFence() {
            String text = "Run this:\n```bash\nnpm install\n```\n";
            assertEquals(List.of("bash: npm install"), extractor.extract(text));
        }

        @Test
        @DisplayName("bullets inside a fence are not extracted separately")
        void bulletsInsideFenceMasked() {
            String text = "```yaml\n- name: build\n- name: test\n```";
            var result = extractor.extract(text);
            assertEquals(1, result.size());
            assertTrue(result.get(0).startsWith("yaml: "));
        }

        @Test
        @DisplayName("untagged fence is claimed but emits nothing")
        void untaggedFence() {
            assertTrue(extractor.extract("```\n- hidden item here\n```").isEmpty());
        }
    }

    @Nested
    @DisplayName("spawn delimiters")
    class SpawnDelimiters {

        @Test
        @DisplayName("new_task block yields its message body")
        void newTaskBlock() {
            String text = "Delegating.\n<new_task>\n<mode>code</mode>\n"
                    + "<message>Implement the parser</message>\n</new_task>";
            assertEquals(List.of("Implement the parser"), extractor.extract(text));
        }

        @Test
        @DisplayName("bullets inside a message belong to the message only")
        void bulletsInsideMessage() {
            String text = "<new_task><message>- step one here\n- step two here</message></new_task>";
            var result = extractor.extract(text);
            assertEquals(1, result.size());
            assertEquals(ExtractionPattern.SPAWN_DELIMITER, extractor.extractDetailed(text).get(0).pattern());
        }

        @Test
        @DisplayName("HTML-escaped brackets and attribute noise are tolerated")
        void escapedBrackets() {
            String text = "&lt;NEW_TASK id=\"1\"&gt;&lt;message&gt;Fix the login bug&lt;/message&gt;&lt;/new_task&gt;";
            assertEquals(List.of("Fix the login bug"), extractor.extract(text));
        }

        @Test
        @DisplayName("bracket form is recognised")
        void bracketForm() {
            String text = "Next: [new_task in code mode: 'Write the migration script'] then wait.";
            assertEquals(List.of("Write the migration script"), extractor.extract(text));
        }

        @Test
        @DisplayName("bracket bodies are JSON-unescaped like indexed prefixes")
        void bracketBodyUnescaped() {
            String text = "Next: [new_task in code mode: 'Write the \\\"fast\\\" migration\\nscript'] then wait.";
            assertEquals(List.of("Write the \"fast\" migration script"), extractor.extract(text));
        }

        @Test
        @DisplayName("named and numeric entities are decoded before matching")
        void entitiesDecoded() {
            String text = "&lt;new_task&gt;&lt;message&gt;Ship the R&amp;D notes&#33;&lt;/message&gt;&lt;/new_task&gt;";
            assertEquals(List.of("Ship the R&D notes!"), extractor.extract(text));
        }

        @Test
        @DisplayName("block without a message body emits nothing")
        void blockWithoutMessage() {
            assertTrue(extractor.extract("<new_task><mode>code</mode></new_task>").isEmpty());
        }
    }

    @Test
    @DisplayName("results are ordered by pattern priority, then source position")
    void priorityOrder() {
        String text = "- bullet item one\n"
                + "<new_task><message>spawned work item</message></new_task>\n"
                + "1. numbered item\n";
        assertEquals(List.of("spawned work item", "bullet item one", "numbered item"), extractor.extract(text));

        var detailed = extractor.extractDetailed(text);
        assertEquals(ExtractionPattern.SPAWN_DELIMITER, detailed.get(0).pattern());
        assertEquals(ExtractionPattern.BULLET, detailed.get(1).pattern());
        assertEquals(ExtractionPattern.NUMBERED, detailed.get(2).pattern());
    }

    @Test
    @DisplayName("custom minimum length applies")
    void customMinimum() {
        var strict = new SubInstructionExtractor(12);
        assertEquals(List.of("long enough item"), strict.extract("- short one\n- long enough item"));
    }
}
