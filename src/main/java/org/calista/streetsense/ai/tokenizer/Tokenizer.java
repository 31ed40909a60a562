package org.calista.streetsense.ai.tokenizer;

import java.util.List;

public interface Tokenizer {
    List<String> tokenize(String text);
}
