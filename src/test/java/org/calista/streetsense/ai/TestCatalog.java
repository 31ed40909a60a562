package org.calista.streetsense.ai;

import org.calista.streetsense.ai.bootstrap.CatalogBootstrapper;
import org.calista.streetsense.ai.core.ClassifierEngine;
import org.calista.streetsense.ai.core.EngineConfig;
import org.calista.streetsense.ai.vocab.VocabularyStore;
import org.calista.streetsense.io.ResourceIO;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;

/**
 * Fresh, isolated fixtures over the bundled catalog. Every call loads a new store.
 */
public final class TestCatalog {

    private TestCatalog() {
    }

    public static VocabularyStore store() {
        try {
            return new CatalogBootstrapper(new ResourceIO(Path.of(".")), EngineConfig.defaultMapper())
                    .load(EngineConfig.defaults().catalog).store;
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static ClassifierEngine engine() {
        return ClassifierEngine.builder().config(EngineConfig.defaults()).build();
    }
}
