package wolfsim.agents;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import wolfsim.domain.PlayerRole;
import wolfsim.llm.ChatMessage;
import wolfsim.llm.LLMClient;
import wolfsim.llm.PromptBuilder;
import wolfsim.memory.MemoryStore;
import wolfsim.memory.MyState;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ReasoningPipelineTest {

  @Mock
  private LLMClient llm;

  @Captor
  private ArgumentCaptor<List<ChatMessage>> captor;

  private MemoryStore memory;
  private ReasoningPipeline pipeline;

  @BeforeEach
  void setUp() {
    memory = new MemoryStore("me");
    memory.registerPlayer("player1");
    memory.registerPlayer("player2");
    pipeline = new ReasoningPipeline(llm, new PromptBuilder(), memory);
  }

  @Test
  void decide_runsMonologueThenExtraction() throws Exception {
    when(llm.complete(anyList(), any())).thenReturn("player2 has been deflecting all day.", "  player2  ");

    ReasoningPipeline.Decision decision = pipeline.decide(PlayerRole.VILLAGER, RoleFlow.DISCUSS, "Recent Game History:\n");

    assertEquals("player2", decision.action());
    assertEquals("player2 has been deflecting all day.", decision.innerMonologue());
    assertFalse(decision.fallback());

    List<MyState.ThoughtEntry> thoughts = memory.myState().thoughtProcess();
    assertEquals(2, thoughts.size());
    assertEquals("player2 has been deflecting all day.", thoughts.get(0).thought());
    assertEquals("Final discussion contribution or vote: player2", thoughts.get(1).thought());

    verify(llm, times(2)).complete(captor.capture(), any());
    List<ChatMessage> first = captor.getAllValues().get(0);
    List<ChatMessage> second = captor.getAllValues().get(1);
    assertTrue(first.get(0).content().startsWith(RolePersona.VILLAGER.strip()));
    assertTrue(second.get(0).content().contains("player2 has been deflecting all day."));
    assertTrue(second.get(0).content().contains("Provide only your final discussion contribution or vote"));
  }

  @Test
  void decide_monologueFailureReturnsFallbackWithoutSecondCall() throws Exception {
    when(llm.complete(anyList(), any())).thenThrow(new IllegalStateException("LLM error 500: boom"));

    ReasoningPipeline.Decision decision = pipeline.decide(PlayerRole.SEER, RoleFlow.INVESTIGATE, "");

    assertEquals(ReasoningPipeline.FALLBACK, decision.action());
    assertTrue(decision.fallback());
    verify(llm, times(1)).complete(anyList(), any());
  }

  @Test
  void decide_extractionFailureReturnsFallback() throws Exception {
    when(llm.complete(anyList(), any()))
        .thenReturn("some reasoning")
        .thenThrow(new IllegalStateException("timeout"));

    ReasoningPipeline.Decision decision = pipeline.decide(PlayerRole.DOCTOR, RoleFlow.PROTECT, "");

    assertEquals(ReasoningPipeline.FALLBACK, decision.action());
    assertEquals("some reasoning", decision.innerMonologue());
  }

  @Test
  void decide_blankActionBecomesFallback() throws Exception {
    when(llm.complete(anyList(), any())).thenReturn("reasoning", "   ");

    assertEquals(ReasoningPipeline.FALLBACK,
        pipeline.decide(PlayerRole.WEREWOLF, RoleFlow.ELIMINATE, "").action());
  }
}
