package com.xpdustry.wordgrid.common.lexicon;

import java.nio.file.Path;

public sealed interface WordSourceConfig {

    record File(Path path) implements WordSourceConfig {}

    record Resource(String path) implements WordSourceConfig {}
}
