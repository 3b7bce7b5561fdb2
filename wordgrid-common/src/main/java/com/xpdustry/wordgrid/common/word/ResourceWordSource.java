package com.xpdustry.wordgrid.common.word;

import com.google.common.base.Preconditions;
import java.io.BufferedReader;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.List;

public final class ResourceWordSource implements WordSource {

    private final String path;
    private final ClassLoader loader;
    private final WordListReader reader;

    public ResourceWordSource(final String path, final ClassLoader loader, final WordListReader reader) {
        Preconditions.checkNotNull(path, "path");
        // ClassLoader resources are never absolute
        this.path = path.startsWith("/") ? path.substring(1) : path;
        this.loader = Preconditions.checkNotNull(loader, "loader");
        this.reader = Preconditions.checkNotNull(reader, "reader");
    }

    @Override
    public List<String> load() throws IOException {
        final var stream = this.loader.getResourceAsStream(this.path);
        if (stream == null) {
            throw new FileNotFoundException("Missing word list resource " + this.path);
        }
        try (final var buffered = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
            return this.reader.read(buffered, this.describe());
        }
    }

    @Override
    public String describe() {
        return "resource " + this.path;
    }
}
