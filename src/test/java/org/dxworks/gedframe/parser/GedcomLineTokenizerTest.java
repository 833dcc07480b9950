package org.dxworks.gedframe.parser;

import org.dxworks.gedframe.exception.MalformedLineException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GedcomLineTokenizerTest {

    @Test
    void splitsLevelTagAndValue() {
        GedcomLine line = GedcomLineTokenizer.tokenize("1 NAME John /Doe/", 2);

        assertThat(line.getLevel()).isEqualTo(1);
        assertThat(line.getXref()).isNull();
        assertThat(line.getTag()).isEqualTo("NAME");
        assertThat(line.getValue()).isEqualTo("John /Doe/");
        assertThat(line.getLineNumber()).isEqualTo(2);
    }

    @Test
    void readsCrossReferenceBeforeTag() {
        GedcomLine line = GedcomLineTokenizer.tokenize("0 @I1@ INDI", 1);

        assertThat(line.getLevel()).isZero();
        assertThat(line.getXref()).isEqualTo("@I1@");
        assertThat(line.getTag()).isEqualTo("INDI");
        assertThat(line.getValue()).isEmpty();
    }

    @Test
    void pointerValueIsNotTakenForXref() {
        GedcomLine line = GedcomLineTokenizer.tokenize("1 HUSB @I1@", 1);

        assertThat(line.getXref()).isNull();
        assertThat(line.getTag()).isEqualTo("HUSB");
        assertThat(line.getValue()).isEqualTo("@I1@");
    }

    @Test
    void keepsInteriorSpacingOfValue() {
        GedcomLine line = GedcomLineTokenizer.tokenize("1 NAME Arthur  /Wrathall/", 1);

        assertThat(line.getValue()).isEqualTo("Arthur  /Wrathall/");
    }

    @Test
    void stripsCarriageReturn() {
        GedcomLine line = GedcomLineTokenizer.tokenize("2 DATE 1 JAN 1900\r", 1);

        assertThat(line.getValue()).isEqualTo("1 JAN 1900");
    }

    @Test
    void rejectsNonNumericLevel() {
        assertThatThrownBy(() -> GedcomLineTokenizer.tokenize("X NAME John", 7))
                .isInstanceOf(MalformedLineException.class)
                .hasMessageContaining("line 7")
                .extracting(e -> ((MalformedLineException) e).getLine())
                .isEqualTo("X NAME John");
    }

    @Test
    void rejectsNegativeLevel() {
        assertThatThrownBy(() -> GedcomLineTokenizer.tokenize("-1 NAME John", 1))
                .isInstanceOf(MalformedLineException.class);
    }

    @Test
    void lineWithoutTagGetsEmptyTag() {
        GedcomLine line = GedcomLineTokenizer.tokenize("0 @I1@", 3);

        assertThat(line.getXref()).isEqualTo("@I1@");
        assertThat(line.getTag()).isEmpty();
        assertThat(line.getValue()).isEmpty();
        assertThat(line.hasValueSeparator()).isFalse();
    }

    @Test
    void tabSeparatesLevelAndTag() {
        GedcomLine line = GedcomLineTokenizer.tokenize("1\tNAME John /Doe/", 2);

        assertThat(line.getLevel()).isEqualTo(1);
        assertThat(line.getTag()).isEqualTo("NAME");
        assertThat(line.getValue()).isEqualTo("John /Doe/");
    }

    @Test
    void repeatedSpacesSeparateLevelXrefAndTag() {
        GedcomLine line = GedcomLineTokenizer.tokenize("0  @F1@   FAM", 1);

        assertThat(line.getLevel()).isZero();
        assertThat(line.getXref()).isEqualTo("@F1@");
        assertThat(line.getTag()).isEqualTo("FAM");
        assertThat(line.getValue()).isEmpty();
    }

    @Test
    void valueKeepsSpacingAfterTheFirstSeparator() {
        GedcomLine line = GedcomLineTokenizer.tokenize("1  NAME  John /Doe/", 1);

        assertThat(line.getTag()).isEqualTo("NAME");
        assertThat(line.getValue()).isEqualTo(" John /Doe/");
    }

    @Test
    void trailingSeparatorIsRecorded() {
        GedcomLine withSeparator = GedcomLineTokenizer.tokenize("1 BIRT ", 1);
        GedcomLine withoutSeparator = GedcomLineTokenizer.tokenize("1 BIRT", 1);

        assertThat(withSeparator.getValue()).isEmpty();
        assertThat(withSeparator.hasValueSeparator()).isTrue();
        assertThat(withoutSeparator.hasValueSeparator()).isFalse();
    }

    @Test
    void rejectsLineWithoutLevel() {
        assertThatThrownBy(() -> GedcomLineTokenizer.tokenize("NAME John", 4))
                .isInstanceOf(MalformedLineException.class)
                .hasMessageContaining("line 4");
    }

    @Test
    void tokenizeAllSkipsBlankLinesButCountsThem() {
        List<GedcomLine> lines = GedcomLineTokenizer.tokenizeAll("0 HEAD\n\n1 SOUR x\r\n   \n0 TRLR\n");

        assertThat(lines).extracting(GedcomLine::getTag).containsExactly("HEAD", "SOUR", "TRLR");
        assertThat(lines).extracting(GedcomLine::getLineNumber).containsExactly(1, 3, 5);
    }

    @Test
    void tokenizeAllOfEmptyTextIsEmpty() {
        assertThat(GedcomLineTokenizer.tokenizeAll("")).isEmpty();
    }
}
