package jitalias;

import static org.hamcrest.Matchers.arrayWithSize;
import static org.hamcrest.Matchers.hasItemInArray;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.startsWith;
import static org.junit.Assert.assertThat;

import org.junit.Test;

public class EnvVarTest {

  @Test
  public void descriptions_nameEveryVariable() throws Exception {
    String[] descriptions = EnvVar.getAllEnvVarDescriptions();
    assertThat(descriptions, arrayWithSize(EnvVar.values().length));
    assertThat(descriptions, hasItemInArray(startsWith("JITALIAS_DUMP_ALIAS_DB: ")));
    assertThat(descriptions, hasItemInArray(startsWith("JITALIAS_CHECK_MOVES: ")));
  }

  @Test
  public void setToZeroAndSetToOne_followTheValue() throws Exception {
    for (EnvVar var : EnvVar.values()) {
      assertThat(var.isSetToZero(), is(var.value().equals("0")));
      assertThat(var.isSetToOne(), is(var.value().equals("1")));
      assertThat(var.isSetToZero() && var.isSetToOne(), is(false));
    }
  }
}
