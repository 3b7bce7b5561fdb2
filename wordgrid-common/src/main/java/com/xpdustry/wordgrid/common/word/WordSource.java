package com.xpdustry.wordgrid.common.word;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * A line oriented word list. Loaded words are lowercase, made of alphabet symbols only and free of duplicates.
 */
public interface WordSource {

    static WordSource file(final Path path) {
        return new PathWordSource(path, WordListReader.DEFAULT);
    }

    static WordSource resource(final String path) {
        return new ResourceWordSource(path, WordSource.class.getClassLoader(), WordListReader.DEFAULT);
    }

    List<String> load() throws IOException;

    String describe();
}
