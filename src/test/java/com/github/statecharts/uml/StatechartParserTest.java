package com.github.statecharts.uml;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Arrays;
import java.util.List;

import org.junit.Test;

import com.github.statecharts.StateMachineException;
import com.github.statecharts.StateMachineException.Code;
import com.github.statecharts.model.ChartAction;
import com.github.statecharts.model.ChartState;
import com.github.statecharts.model.ChartTransition;
import com.github.statecharts.model.HandlerKind;
import com.github.statecharts.model.PragmaKind;
import com.github.statecharts.model.Statechart;

/**
 * Tests for the grammar parser and the parse tree to model assembly.
 */
public class StatechartParserTest {
  static {
    System.setProperty("log4j.configurationFile", "log4j.properties");
  }

  static final String GUMBALL = String.join("\n",
      "' Head First gumball machine",
      "@startuml Gumball",
      "'[brief] Gumball dispenser",
      "'[param] int count",
      "'[init] count = 1;",
      "skinparam shadowing false",
      "[*] --> NoQuarter",
      "NoQuarter --> HasQuarter : insert quarter",
      "HasQuarter --> NoQuarter : eject quarter",
      "HasQuarter --> GumballSold : turn crank / count = count - 1",
      "GumballSold --> NoQuarter : [count > 0]",
      "GumballSold --> OutOfGumballs : [count == 0]",
      "note right of OutOfGumballs : refill required",
      "@enduml",
      "");

  @Test
  public void testParseTree() throws StateMachineException {
    final SyntaxTree.ChartNode chart = StatechartParser.parse(GUMBALL);
    assertEquals("Gumball", chart.getName());
    // 3 pragmas, 1 directive, 6 transitions, 1 note
    assertEquals(11, chart.getBody().size());
    assertTrue(chart.getBody().get(0) instanceof SyntaxTree.PragmaNode);
    assertTrue(chart.getBody().get(3) instanceof SyntaxTree.DirectiveNode);
    assertTrue(chart.getBody().get(10) instanceof SyntaxTree.NoteNode);

    final SyntaxTree.TransitionNode crank = (SyntaxTree.TransitionNode) chart.getBody().get(7);
    assertEquals("HasQuarter", crank.getLeft());
    assertEquals("GumballSold", crank.getRight());
    assertEquals(Arrays.asList("turn", "crank"), crank.getLabel().getWords());
    assertEquals("count = count - 1", crank.getLabel().getAction().get().getText());
    assertEquals(10, crank.getLine());
  }

  @Test
  public void testAssembledGumball() throws StateMachineException {
    final Statechart chart = Statecharts.parse("fallback", GUMBALL);
    assertEquals("Gumball", chart.getName());
    assertEquals(Arrays.asList("NoQuarter", "HasQuarter", "GumballSold", "OutOfGumballs"),
        Arrays.asList(chart.getStates().keySet().toArray()));
    assertEquals("NoQuarter", chart.getInitialState().get());
    assertFalse(chart.hasFinalState());
    assertEquals(Arrays.asList("Gumball dispenser"), chart.getPragmas(PragmaKind.BRIEF));
    assertEquals(Arrays.asList("int count"), chart.getPragmas(PragmaKind.PARAM));

    // keys in declaration order, event-less transitions under ""
    assertEquals(Arrays.asList("insert quarter", "eject quarter", "turn crank", ""),
        Arrays.asList(chart.getTransitionsByEvent().keySet().toArray()));
    final List<ChartTransition> eventless = chart.getTransitionsByEvent().get("");
    assertEquals(2, eventless.size());
    assertEquals("count > 0", eventless.get(0).getGuard().get());
    assertEquals("OutOfGumballs", eventless.get(1).getDestination());
  }

  @Test
  public void testAllArrowSpellings() throws StateMachineException {
    final Statechart chart = Statecharts.parse("arrows", String.join("\n",
        "@startuml",
        "[*] -> A",
        "A --> B : one",
        "A -> C : two",
        "A <-- D : three",
        "A <- E : four",
        "@enduml"));
    assertEquals("arrows", chart.getName());
    final List<ChartTransition> transitions = chart.getTransitions();
    assertEquals("A", transitions.get(1).getSource());
    assertEquals("B", transitions.get(1).getDestination());
    assertEquals("C", transitions.get(2).getDestination());
    // reversed arrows are swapped
    assertEquals("D", transitions.get(3).getSource());
    assertEquals("A", transitions.get(3).getDestination());
    assertEquals("<--", transitions.get(3).getArrow());
    assertEquals("E", transitions.get(4).getSource());
    assertEquals("A", transitions.get(4).getDestination());
    assertTrue(transitions.get(0).isInitial());
  }

  @Test
  public void testStateClauses() throws StateMachineException {
    final Statechart chart = Statecharts.parse("clauses", String.join("\n",
        "@startuml",
        "[*] --> Idle",
        "Idle : entry / led(ON);",
        "Idle : leaving \\n--\\n led(OFF);",
        "Idle : do / poll();",
        "Idle : on tick [armed] / count++;",
        "Idle : comment / waits for work",
        "Idle --> [*] : stop",
        "@enduml"));
    final ChartState idle = chart.getState("Idle").get();
    assertEquals("led(ON);", idle.getHandler(HandlerKind.ENTRY).get().getText());
    assertEquals(ChartAction.Form.BLOCK, idle.getHandler(HandlerKind.EXIT).get().getForm());
    assertEquals("led(OFF);", idle.getHandler(HandlerKind.EXIT).get().getText());
    assertEquals("poll();", idle.getHandler(HandlerKind.ACTIVITY).get().getText());
    assertEquals("count++;", idle.getHandler(HandlerKind.INTERNAL).get().getText());
    assertEquals("waits for work", idle.getComment().get());
    assertTrue(chart.hasFinalState());

    // the on clause becomes an internal self-transition without action
    final ChartTransition tick = chart.getTransitionsByEvent().get("tick").get(0);
    assertTrue(tick.isInternal());
    assertEquals("Idle", tick.getSource());
    assertEquals("Idle", tick.getDestination());
    assertEquals("armed", tick.getGuard().get());
    assertFalse(tick.getAction().isPresent());
  }

  @Test
  public void testNestedAndConcurrentStates() throws StateMachineException {
    final Statechart chart = Statecharts.parse("nested", String.join("\n",
        "@startuml",
        "[*] --> Off",
        "state Off",
        "state On {",
        "  [*] --> Low",
        "  Low --> High : up",
        "  --",
        "  [*] --> Quiet",
        "  Quiet --> Loud : louder",
        "}",
        "Off --> On : power",
        "On --> Off : power",
        "@enduml"));
    assertEquals(Arrays.asList("Off", "On"), Arrays.asList(chart.getStates().keySet().toArray()));
    final ChartState on = chart.getState("On").get();
    assertTrue(on.isComposite());
    assertTrue(on.isOrthogonal());
    assertEquals(2, on.getRegions().size());
    assertEquals("Low", on.getRegions().get(0).getInitialState().get());
    assertEquals("Quiet", on.getRegions().get(1).getInitialState().get());
    assertTrue(on.getRegions().get(1).getState("Loud").isPresent());
    assertFalse(chart.getState("Low").isPresent());
    assertEquals(2, chart.getChildren().size());
    assertFalse(chart.getState("Off").get().isComposite());
  }

  @Test
  public void testEmptyStateBlockOnOneLine() throws StateMachineException {
    final Statechart chart = Statecharts.parse("empty", String.join("\n",
        "@startuml",
        "[*] --> A",
        "state A {}",
        "state B { }",
        "A --> B : go",
        "@enduml"));
    assertFalse(chart.getState("A").get().isComposite());
    assertFalse(chart.getState("B").get().isComposite());
    assertEquals(2, chart.getTransitions().size());
  }

  @Test
  public void testSyntaxErrorsCarryLineAndColumn() {
    assertSyntaxError("@startuml\nA -->\n@enduml", 2, 6);
    assertSyntaxError("A --> B\n@enduml", 1, 1);
    assertSyntaxError("@startuml\n--\n@enduml", 2, 1);
    assertSyntaxError("@startuml\nA : wobble / x\n@enduml", 2, 5);
    assertSyntaxError("@startuml\nA : entry\n@enduml", 2, 5);
    assertSyntaxError("@startuml\n'[bogus] text\n@enduml", 2, 2);
    assertSyntaxError("@startuml\nstate A {\nA --> B\n@enduml", 4, 1);
    assertSyntaxError("@startuml\nA --> B : go / x [late]\nB --> A\n@enduml\nC --> D", 5, 1);
  }

  private static void assertSyntaxError(final String source, final int line, final int column) {
    try {
      StatechartParser.parse(source);
      fail("accepted malformed source:\n" + source);
    } catch (StateMachineException expected) {
      assertEquals(Code.SYNTAX_ERROR, expected.getCode());
      final Diagnostic diagnostic = expected.getDiagnostics().get(0);
      assertTrue(diagnostic.isError());
      assertEquals(expected.getMessage(), line, diagnostic.getLine());
      assertEquals(expected.getMessage(), column, diagnostic.getColumn());
    }
  }
}
