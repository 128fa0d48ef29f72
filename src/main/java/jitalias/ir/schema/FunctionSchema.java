package jitalias.ir.schema;

import static org.jooq.lambda.Seq.seq;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;
import jitalias.ir.Symbol;
import jitalias.ir.types.Type;
import org.jetbrains.annotations.Nullable;

/**
 * The declared contract of an operator: ordered arguments and returns, optionally carrying alias
 * annotations.
 *
 * <p>A vararg schema accepts more inputs than it declares arguments, a varret schema produces more
 * outputs than it declares returns. Alias annotations can't be matched to the extra values.
 */
public final class FunctionSchema {

  public final Symbol name;
  private final ImmutableList<Argument> arguments;
  private final ImmutableList<Argument> returns;
  private final boolean isVararg;
  private final boolean isVarret;
  private final AliasAnalysisKind aliasAnalysis;

  public FunctionSchema(
      Symbol name,
      List<Argument> arguments,
      List<Argument> returns,
      boolean isVararg,
      boolean isVarret,
      AliasAnalysisKind aliasAnalysis) {
    this.name = name;
    this.arguments = ImmutableList.copyOf(arguments);
    this.returns = ImmutableList.copyOf(returns);
    this.isVararg = isVararg;
    this.isVarret = isVarret;
    this.aliasAnalysis = aliasAnalysis;
  }

  public FunctionSchema(Symbol name, List<Argument> arguments, List<Argument> returns) {
    this(name, arguments, returns, false, false, AliasAnalysisKind.FROM_SCHEMA);
  }

  public static Builder builder(Symbol name) {
    return new Builder(name);
  }

  public List<Argument> arguments() {
    return arguments;
  }

  public List<Argument> returns() {
    return returns;
  }

  public boolean isVararg() {
    return isVararg;
  }

  public boolean isVarret() {
    return isVarret;
  }

  /** Registered with the operator, independent of its alias annotations. */
  public AliasAnalysisKind aliasAnalysis() {
    return aliasAnalysis;
  }

  @Override
  public String toString() {
    String args = listing(arguments, isVararg);
    String rets = listing(returns, isVarret);
    if (returns.size() != 1 || isVarret) {
      rets = "(" + rets + ")";
    }
    return name.toQualString() + "(" + args + ") -> " + rets;
  }

  private static String listing(List<Argument> formals, boolean variadic) {
    List<String> printed = seq(formals).map(Argument::toString).toList();
    if (variadic) {
      printed.add("...");
    }
    return String.join(", ", printed);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    FunctionSchema that = (FunctionSchema) o;
    return isVararg == that.isVararg
        && isVarret == that.isVarret
        && aliasAnalysis == that.aliasAnalysis
        && Objects.equals(name, that.name)
        && Objects.equals(arguments, that.arguments)
        && Objects.equals(returns, that.returns);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, arguments, returns, isVararg, isVarret, aliasAnalysis);
  }

  public static class Builder {
    private final Symbol name;
    private final ImmutableList.Builder<Argument> arguments = ImmutableList.builder();
    private final ImmutableList.Builder<Argument> returns = ImmutableList.builder();
    private boolean isVararg;
    private boolean isVarret;
    private AliasAnalysisKind aliasAnalysis = AliasAnalysisKind.FROM_SCHEMA;

    private Builder(Symbol name) {
      this.name = name;
    }

    public Builder arg(String name, Type type) {
      return arg(name, type, null);
    }

    public Builder arg(String name, Type type, @Nullable AliasInfo aliasInfo) {
      arguments.add(new Argument(name, type, aliasInfo));
      return this;
    }

    public Builder ret(Type type) {
      return ret(type, null);
    }

    public Builder ret(Type type, @Nullable AliasInfo aliasInfo) {
      returns.add(new Argument("", type, aliasInfo));
      return this;
    }

    public Builder vararg() {
      isVararg = true;
      return this;
    }

    public Builder varret() {
      isVarret = true;
      return this;
    }

    public Builder aliasAnalysis(AliasAnalysisKind aliasAnalysis) {
      this.aliasAnalysis = aliasAnalysis;
      return this;
    }

    public FunctionSchema build() {
      return new FunctionSchema(
          name, arguments.build(), returns.build(), isVararg, isVarret, aliasAnalysis);
    }
  }
}
