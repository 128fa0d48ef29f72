package jitalias.ir.alias;

import static com.github.npathai.hamcrestopt.OptionalMatchers.*;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertThat;

import jitalias.ir.types.Type;
import jitalias.ir.types.TypeKind;
import org.junit.Test;

public class MutableTypesTest {

  @Test
  public void tensorSubtypes_shareTheTensorKind() throws Exception {
    assertThat(MutableTypes.mutableKind(Type.TENSOR), hasValue(TypeKind.TENSOR));
    assertThat(MutableTypes.mutableKind(Type.COMPLETE_TENSOR), hasValue(TypeKind.TENSOR));
    assertThat(MutableTypes.mutableKind(Type.DIMENSIONED_TENSOR), hasValue(TypeKind.TENSOR));
  }

  @Test
  public void containersAndObjects_areTheirOwnKind() throws Exception {
    assertThat(MutableTypes.mutableKind(Type.listOf(Type.INT)), hasValue(TypeKind.LIST));
    assertThat(MutableTypes.mutableKind(Type.tupleOf(Type.INT)), hasValue(TypeKind.TUPLE));
    assertThat(
        MutableTypes.mutableKind(Type.dictOf(Type.STRING, Type.TENSOR)), hasValue(TypeKind.DICT));
    assertThat(MutableTypes.mutableKind(Type.classType("Module")), hasValue(TypeKind.CLASS));
  }

  @Test
  public void optionalAndFuture_unwrap() throws Exception {
    assertThat(MutableTypes.mutableKind(Type.optionalOf(Type.TENSOR)), hasValue(TypeKind.TENSOR));
    assertThat(
        MutableTypes.mutableKind(Type.futureOf(Type.listOf(Type.TENSOR))),
        hasValue(TypeKind.LIST));
    assertThat(MutableTypes.mutableKind(Type.optionalOf(Type.INT)), isEmpty());
    assertThat(MutableTypes.mutableKind(Type.futureOf(Type.FLOAT)), isEmpty());
  }

  @Test
  public void primitives_areNotTracked() throws Exception {
    for (Type primitive :
        new Type[] {Type.INT, Type.FLOAT, Type.BOOL, Type.STRING, Type.NUMBER, Type.NONE}) {
      assertThat(primitive.toString(), MutableTypes.shouldAnnotate(primitive), is(false));
    }
  }

  @Test
  public void isContainerType_looksThroughOptional() throws Exception {
    assertThat(MutableTypes.isContainerType(Type.tupleOf(Type.TENSOR)), is(true));
    assertThat(MutableTypes.isContainerType(Type.optionalOf(Type.listOf(Type.INT))), is(true));
    assertThat(MutableTypes.isContainerType(Type.TENSOR), is(false));
    assertThat(MutableTypes.isContainerType(Type.optionalOf(Type.TENSOR)), is(false));
    assertThat(MutableTypes.isContainerType(Type.classType("Module")), is(false));
  }
}
