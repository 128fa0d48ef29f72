package jitalias.ir;

import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertThat;

import org.junit.Test;

public class SymbolTest {

  @Test
  public void fromQualString_splitsNamespace() throws Exception {
    Symbol symbol = Symbol.fromQualString("aten::add_");
    assertThat(symbol, is(Symbol.aten("add_")));
    assertThat(symbol.isAten(), is(true));
    assertThat(symbol.isPrim(), is(false));
    assertThat(symbol.toQualString(), is("aten::add_"));
  }

  @Test
  public void customNamespace_isNeitherAtenNorPrim() throws Exception {
    Symbol symbol = Symbol.fromQualString("custom::op");
    assertThat(symbol.isAten() || symbol.isPrim(), is(false));
  }

  @Test(expected = IllegalArgumentException.class)
  public void fromQualString_withoutNamespace_throws() throws Exception {
    Symbol.fromQualString("add_");
  }
}
