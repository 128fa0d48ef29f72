package jitalias;

import java.util.ArrayList;
import java.util.List;

/** Debugging switches, read from the process environment on every query. */
public enum EnvVar {
  JITALIAS_DUMP_ALIAS_DB("Set to \"1\" to log the alias database after it was built."),
  JITALIAS_CHECK_MOVES(
      "Set to \"1\" to verify def-before-use order of a block after every executed move.");

  public final String description;

  EnvVar(String description) {
    this.description = description;
  }

  /** The variable's value, or the empty string if it isn't set. */
  public String value() {
    String value = System.getenv(name());
    return value == null ? "" : value;
  }

  public boolean isSetToOne() {
    return value().equals("1");
  }

  public boolean isSetToZero() {
    return value().equals("0");
  }

  public static String[] getAllEnvVarDescriptions() {
    List<String> descriptions = new ArrayList<>();
    for (EnvVar var : values()) {
      descriptions.add(var.name() + ": " + var.description);
    }
    return descriptions.toArray(new String[0]);
  }
}
