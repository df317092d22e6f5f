package nfadfa.codegen;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import nfadfa.graph.Dfa;
import org.objectweb.asm.Label;
import org.objectweb.asm.MethodVisitor;
import org.objectweb.asm.Opcodes;

/**
 * Generates the body of a DFA membership test.
 *
 * <p>This uses the natural mapping of a DFA into the control-flow graph of the
 * bytecode method: states are represented by blocks, and transitions are jumps
 * to other blocks. The generated method has the signature
 * {@code static boolean acceptsStatic(int[] symbols)}.
 */
class DfaMethodCodegen extends BytecodeHelpers {

  /**
   * DFA for which code is generated.
   */
  private final Dfa dfa;

  /**
   * Interned id of every symbol in the DFA alphabet.
   */
  private final Map<String, Integer> symbolIds;

  /**
   * If set, the generated method prints states entered and symbols read to
   * "standard" error.
   */
  private final boolean printDebugInfo;

  // Local variable offsets (all single-width)
  private final int inputLocal = 0;
  private final int offsetLocal = 1;
  private final int lengthLocal = 2;

  /**
   * Labels associated with DFA states, in state order.
   */
  private final Map<String, Label> stateLabels;

  private final Label returnSuccess = new Label();
  private final Label returnFailure = new Label();

  DfaMethodCodegen(
    MethodVisitor mv,
    Dfa dfa,
    Map<String, Integer> symbolIds,
    boolean printDebugInfo
  ) {
    super(mv);
    this.dfa = dfa;
    this.symbolIds = symbolIds;
    this.printDebugInfo = printDebugInfo;

    final var labels = new LinkedHashMap<String, Label>();
    for (String state : dfa.states()) {
      labels.put(state, new Label());
    }
    this.stateLabels = Collections.unmodifiableMap(labels);
  }

  public void visitDfa() {

    // length = symbols.length; offset = -1
    mv.visitVarInsn(Opcodes.ALOAD, inputLocal);
    mv.visitInsn(Opcodes.ARRAYLENGTH);
    mv.visitVarInsn(Opcodes.ISTORE, lengthLocal);
    visitConstantInt(-1);
    mv.visitVarInsn(Opcodes.ISTORE, offsetLocal);

    mv.visitJumpInsn(Opcodes.GOTO, stateLabels.get(dfa.startState()));

    for (Map.Entry<String, Label> entry : stateLabels.entrySet()) {
      visitState(entry.getKey(), entry.getValue());
    }

    mv.visitLabel(returnSuccess);
    if (printDebugInfo) {
      visitPrintErrConstantLine("[DFA] accepted");
    }
    mv.visitInsn(Opcodes.ICONST_1);
    mv.visitInsn(Opcodes.IRETURN);

    mv.visitLabel(returnFailure);
    if (printDebugInfo) {
      visitPrintErrConstantLine("[DFA] rejected");
    }
    mv.visitInsn(Opcodes.ICONST_0);
    mv.visitInsn(Opcodes.IRETURN);
  }

  /**
   * Emit the block for one state.
   *
   * <p>The block advances the offset, finishes the run if the input is
   * exhausted, and otherwise branches on the next symbol id.
   */
  private void visitState(String state, Label label) {
    mv.visitLabel(label);
    if (printDebugInfo) {
      visitPrintErrConstantLine("[DFA] entering " + state);
    }

    mv.visitIincInsn(offsetLocal, 1);
    mv.visitVarInsn(Opcodes.ILOAD, offsetLocal);
    mv.visitVarInsn(Opcodes.ILOAD, lengthLocal);
    final boolean accepting = dfa.finalStates().contains(state);
    mv.visitJumpInsn(Opcodes.IF_ICMPGE, accepting ? returnSuccess : returnFailure);

    // symbols[offset]
    mv.visitVarInsn(Opcodes.ALOAD, inputLocal);
    mv.visitVarInsn(Opcodes.ILOAD, offsetLocal);
    mv.visitInsn(Opcodes.IALOAD);
    if (printDebugInfo) {
      visitPrintErrIntPeek();
    }

    // Order the branches by symbol id
    final SortedMap<Integer, Label> branches = new TreeMap<>();
    for (Map.Entry<String, String> transition : dfa.transitionsFrom(state).entrySet()) {
      final Integer symbolId = symbolIds.get(transition.getKey());
      if (symbolId == null) {
        throw new IllegalArgumentException("symbol " + transition.getKey() + " has no interned id");
      }
      branches.put(symbolId, stateLabels.get(transition.getValue()));
    }

    final int[] values = branches.keySet().stream().mapToInt(Integer::intValue).toArray();
    final Label[] labels = branches.values().toArray(Label[]::new);
    visitLookupBranch(returnFailure, values, labels);
  }
}
