package com.phillippitts.speechgate.service.stt;

import com.phillippitts.speechgate.domain.TranscriptFragment;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TranscriptStitcherTest {

    @Test
    void joinsFragmentsWithSingleSpaces() {
        String text = TranscriptStitcher.stitch(List.of(
                new TranscriptFragment(0, " hello "),
                new TranscriptFragment(1, "world")));

        assertThat(text).isEqualTo("hello world");
    }

    @Test
    void skipsBlankFragments() {
        String text = TranscriptStitcher.stitch(List.of(
                new TranscriptFragment(0, "a"),
                new TranscriptFragment(1, "   "),
                new TranscriptFragment(2, "b")));

        assertThat(text).isEqualTo("a b");
    }

    @Test
    void noFragmentsGiveEmptyText() {
        assertThat(TranscriptStitcher.stitch(List.of())).isEmpty();
    }

    @Test
    void collapsesSentenceEndersRepeatedAcrossSeam() {
        String text = TranscriptStitcher.stitch(List.of(
                new TranscriptFragment(0, "今天天气很好。"),
                new TranscriptFragment(1, "。我们出去吧！")));

        assertThat(text).isEqualTo("今天天气很好。我们出去吧！");
    }

    @Test
    void removesSpaceBeforePunctuation() {
        assertThat(TranscriptStitcher.normalize("hello , world !")).isEqualTo("hello, world!");
        assertThat(TranscriptStitcher.normalize("你好 ，世界")).isEqualTo("你好，世界");
    }

    @Test
    void squeezesWhitespace() {
        assertThat(TranscriptStitcher.normalize("  a \t\n b  ")).isEqualTo("a b");
    }

    @Test
    void keepsEllipsis() {
        assertThat(TranscriptStitcher.normalize("wait...")).isEqualTo("wait...");
    }

    @Test
    void normalizationIsIdempotent() {
        for (String input : List.of("好。 。 。 好", "a ! ! b ?? c", "x , y ; z", "嗯……", "  ")) {
            String once = TranscriptStitcher.normalize(input);

            assertThat(TranscriptStitcher.normalize(once)).as("normalize twice: %s", input).isEqualTo(once);
        }
    }
}
