package org.calista.steer.text;

import java.util.List;

/** Splits raw text into generator tokens. */
public interface Tokenizer {

    List<String> tokenize(String text);
}
