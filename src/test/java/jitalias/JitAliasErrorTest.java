package jitalias;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.Assert.assertThat;

import java.io.IOException;
import org.junit.Test;

public class JitAliasErrorTest {

  @Test
  public void wrappedException_isKeptAsCause() throws Exception {
    IOException cause = new IOException("cannot read graph");
    JitAliasError error = new JitAliasError(cause);
    assertThat(error.getCause(), is(sameInstance(cause)));
    assertThat(error.getMessage(), containsString("cannot read graph"));
  }

  @Test
  public void messageOnly_hasNoCause() throws Exception {
    JitAliasError error = new JitAliasError("bad graph");
    assertThat(error.getMessage(), is("bad graph"));
    assertThat(error.getCause(), is(nullValue()));
  }
}
