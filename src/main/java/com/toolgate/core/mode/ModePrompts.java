package com.toolgate.core.mode;

/**
 * Mode-specific instruction blocks prepended to the agent's system prompt.
 */
final class ModePrompts {

    private ModePrompts() {}

    static String modifierFor(OperatingMode mode) {
        return switch (mode) {
            case PLAN -> """
                    <active_mode>PLAN</active_mode>
                    <rules>Read-only mode. Use: read_file, grep, bash (ls/cat/grep). NO writes or modifications. \
                    Create detailed plans. Wait for approval ("approved" / "go ahead") before execution.</rules>
                    <style>Verbose, pedagogical. Ask questions. Validate assumptions.</style>""";
            case NORMAL -> """
                    <active_mode>NORMAL</active_mode>
                    <rules>Reads auto-approved. Writes need confirmation. Explain before acting.</rules>
                    <style>Concise but complete. Confirm risky operations.</style>""";
            case AUTO -> """
                    <active_mode>AUTO</active_mode>
                    <rules>All tools auto-approved. Execute without waiting. Explain actions but don't ask permission.</rules>
                    <style>Confident, efficient. Maintain momentum.</style>""";
            case YOLO -> """
                    <active_mode>YOLO</active_mode>
                    <rules>Instant auto-approval. MINIMIZE output. Execute rapidly. Quality maintained.</rules>
                    <style>Ultra-concise. Verbose only on errors. Chain actions silently.</style>""";
            case ARCHITECT -> """
                    <active_mode>ARCHITECT</active_mode>
                    <rules>High-level design only. Read-only tools. NO modifications. Think in systems and patterns. \
                    Use mermaid diagrams. Present options with trade-offs.</rules>
                    <style>Abstract, conceptual. Focus on what and why, not how.</style>""";
        };
    }
}
