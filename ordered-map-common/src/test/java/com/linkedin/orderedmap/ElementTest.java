package com.linkedin.orderedmap;

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertNotEquals;
import static org.testng.Assert.assertThrows;

import java.util.AbstractMap;
import java.util.Map;
import org.testng.annotations.Test;


public class ElementTest {
  @Test
  public void testEntryContract() {
    Element<String, Integer> element = Element.create("a", 1);
    Map.Entry<String, Integer> jdkEntry = new AbstractMap.SimpleImmutableEntry<>("a", 1);

    assertEquals(element.getKey(), "a");
    assertEquals((int) element.getValue(), 1);
    assertEquals(element, jdkEntry);
    assertEquals(jdkEntry, element);
    assertEquals(element.hashCode(), jdkEntry.hashCode());
    assertEquals(element.toString(), "a=1");
    assertNotEquals(element, Element.create("a", 2));
    assertNotEquals(element, "a=1");
  }

  @Test
  public void testNullsAreAllowed() {
    Element<String, String> element = new Element<>(null, null);
    assertEquals(element, Element.create(null, null));
    assertEquals(element.hashCode(), 0);
  }

  @Test
  public void testImmutable() {
    assertThrows(UnsupportedOperationException.class, () -> Element.create("a", 1).setValue(2));
  }
}
