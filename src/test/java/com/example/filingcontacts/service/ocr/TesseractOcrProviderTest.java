package com.example.filingcontacts.service.ocr;

import com.example.filingcontacts.TestPdfs;
import com.example.filingcontacts.dto.OcrResult;
import net.sourceforge.tess4j.TesseractException;
import org.apache.commons.lang3.StringUtils;
import org.junit.jupiter.api.Test;

import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class TesseractOcrProviderTest {

    private static final String LONG_TEXT = StringUtils.repeat("Smith Family Trust ", 10);

    @Test
    void singleBlockPassIsEnoughForDenseText() throws Exception {
        ScriptedProvider provider = new ScriptedProvider(Map.of(6, LONG_TEXT, 4, "unused"));

        OcrResult result = provider.extractText(TestPdfs.blankPages(2));

        assertThat(provider.modes).containsExactly(6, 6);
        assertThat(result.getText()).isEqualTo(LONG_TEXT.trim() + "\n\n" + LONG_TEXT.trim());
    }

    @Test
    void sparseTextGetsSingleColumnPassAndLongerWins() throws Exception {
        ScriptedProvider provider = new ScriptedProvider(Map.of(6, "Smith", 4, "Smith Family Trust"));

        OcrResult result = provider.extractText(TestPdfs.blankPages(1));

        assertThat(provider.modes).containsExactly(6, 4);
        assertThat(result.getText()).isEqualTo("Smith Family Trust");
    }

    @Test
    void firstPassKeptWhenSecondIsShorter() throws Exception {
        ScriptedProvider provider = new ScriptedProvider(Map.of(6, "Smith Family", 4, "Sm"));

        assertThat(provider.extractText(TestPdfs.blankPages(1)).getText()).isEqualTo("Smith Family");
    }

    @Test
    void failedPassCountsAsEmpty() throws Exception {
        ScriptedProvider provider = new ScriptedProvider(Map.of(4, "Recovered text"));

        OcrResult result = provider.extractText(TestPdfs.blankPages(1));

        assertThat(result.getText()).isEqualTo("Recovered text");
    }

    private static class ScriptedProvider extends TesseractOcrProvider {
        private final Map<Integer, String> textByMode;
        private final List<Integer> modes = new ArrayList<>();

        ScriptedProvider(Map<Integer, String> textByMode) {
            this.textByMode = textByMode;
        }

        @Override
        protected String ocrPage(BufferedImage image, int pageSegMode) throws TesseractException {
            modes.add(pageSegMode);
            String text = textByMode.get(pageSegMode);
            if (text == null) {
                throw new TesseractException("no text for psm " + pageSegMode);
            }
            return text;
        }
    }
}
