package com.xpdustry.wordgrid.common.word;

import com.google.common.base.Preconditions;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

public final class PathWordSource implements WordSource {

    private final Path path;
    private final WordListReader reader;

    public PathWordSource(final Path path, final WordListReader reader) {
        this.path = Preconditions.checkNotNull(path, "path");
        this.reader = Preconditions.checkNotNull(reader, "reader");
    }

    @Override
    public List<String> load() throws IOException {
        try (final var stream = Files.newBufferedReader(this.path, StandardCharsets.UTF_8)) {
            return this.reader.read(stream, this.describe());
        }
    }

    @Override
    public String describe() {
        return "file " + this.path.toAbsolutePath();
    }
}
