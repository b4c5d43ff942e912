package wolfsim.llm;

import java.util.List;

public interface LLMClient {
  /** Chat completion; {@code options} may be null to use the client defaults. */
  String complete(List<ChatMessage> messages, LLMRequestOptions options) throws Exception;
}
