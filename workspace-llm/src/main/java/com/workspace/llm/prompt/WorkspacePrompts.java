package com.workspace.llm.prompt;

/**
 * Prompt templates for every generation call the workspace makes.
 */
public final class WorkspacePrompts {

    public static final String NO_PREVIOUS_STEPS = "(no previous steps)";
    public static final String NO_STEPS_EXECUTED = "(no internal steps executed)";
    public static final String NO_CONTEXT_FOUND = "(no context found)";

    private WorkspacePrompts() {}

    /**
     * Short answer grounded only in the numbered retrieval snippets.
     */
    public static String buildGroundedAnswerPrompt(String question, String context) {
        return """
            The user asked:
            %s

            Here are context snippets from their Study RAG library:
            %s

            Provide a short, direct answer using ONLY this context.
            If you truly cannot answer from it, say so honestly.
            """.formatted(question, context).strip();
    }

    /**
     * Asks the manager model to pick the next tool. The model must answer with a single JSON object.
     */
    public static String buildManagerDecisionPrompt(String question, String history) {
        return """
            You are the manager brain for Workspace Agent.

            The user asked:
            %s

            Internal tool-call history so far:
            %s

            Tools you can choose:
              - "rag": call Study RAG /query to fetch top-K chunks.
              - "copilot": call Lab Copilot /chat (which itself uses RAG).
              - "final": stop calling tools and produce the final answer.

            Respond with STRICT JSON, no extra text:
            {
              "action": "rag" | "copilot" | "final",
              "reason": "short explanation"
            }
            """.formatted(question, history).strip();
    }

    /**
     * Final answer synthesized from the internal trace only.
     */
    public static String buildManagerAnswerPrompt(String question, String history) {
        return """
            You are Workspace Agent.

            The user asked:
            %s

            Here is the internal tool-call trace:
            %s

            Using ONLY what is implied or explicitly stated in that trace,
            provide a clear, concise answer. If information is missing, say so
            instead of hallucinating.
            """.formatted(question, history).strip();
    }

    public static String buildStudyGuidePrompt(String question, String context) {
        return """
            You are a strict but helpful study planner.

            The user wants a study guide for:
            %s

            Here is the context from their Study RAG library:
            %s

            Build a clear, structured study guide that stays grounded in the context.
            Requirements:
            - Use markdown.
            - Start with a short overview.
            - Then create 5-10 sections with headings.
            - Under each section, list concrete bullet points, exercises, or checkpoints.
            - Do NOT invent facts that are not supported by the context.
            """.formatted(question, context).strip();
    }
}
