package com.z254.magi.llm;

/**
 * Per-call switches for {@link ProviderClient#invoke}.
 *
 * @param toolsEnabled advertise the agent tools and run the tool loop
 */
public record InvocationOptions(boolean toolsEnabled) {

    public static InvocationOptions withTools() {
        return new InvocationOptions(true);
    }

    public static InvocationOptions plain() {
        return new InvocationOptions(false);
    }
}
