package com.xpdustry.wordgrid.common.word;

import com.google.common.base.Preconditions;
import com.xpdustry.wordgrid.common.trie.Alphabet;
import java.io.BufferedReader;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses word lists, one word per line. Lines are trimmed and lowercased, blank lines and {@code #} comments are
 * skipped, as well as words shorter than the minimum length or containing symbols outside the {@link Alphabet}.
 */
public final class WordListReader {

    public static final WordListReader DEFAULT = new WordListReader(1);

    private static final Logger LOGGER = LoggerFactory.getLogger(WordListReader.class);

    private final int minimumLength;

    public WordListReader(final int minimumLength) {
        Preconditions.checkArgument(minimumLength >= 1, "The minimum length must be positive, got %s", minimumLength);
        this.minimumLength = minimumLength;
    }

    public int minimumLength() {
        return this.minimumLength;
    }

    public List<String> read(final BufferedReader reader, final String origin) throws IOException {
        final var words = new LinkedHashSet<String>();
        var rejected = 0;
        var number = 0;
        String line;
        while ((line = reader.readLine()) != null) {
            number++;
            line = line.trim().toLowerCase(Locale.ROOT);
            if (line.isBlank() || line.startsWith("#") || line.length() < this.minimumLength) {
                continue;
            }
            if (!Alphabet.isWord(line)) {
                LOGGER.debug("Rejected word '{}' at {}:{}", line, origin, number);
                rejected++;
                continue;
            }
            words.add(line);
        }
        if (rejected > 0) {
            LOGGER.warn("Rejected {} words with symbols outside of the alphabet in {}", rejected, origin);
        }
        return new ArrayList<>(words);
    }
}
