package io.github.genie.flake.core.codec;

public class InvalidBase62Exception extends IllegalArgumentException {

    private final String input;
    private final int index;

    public InvalidBase62Exception(String input, int index) {
        super("invalid base62 representation: '" + input + "' at index " + index);
        this.input = input;
        this.index = index;
    }

    public String getInput() {
        return input;
    }

    public int getIndex() {
        return index;
    }
}
