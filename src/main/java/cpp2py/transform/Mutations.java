package cpp2py.transform;

import java.util.Set;

/**
 * What a statement subtree writes.
 *
 * @param rebound  names bound to a new value ({@code x = ...}, {@code x++}, {@code cin >> x})
 * @param mutated  rebound names plus roots of element and member writes ({@code a[i] = ...} mutates {@code a})
 * @param declared names introduced by declarations
 * @param hasCalls whether any function call appears
 */
public record Mutations(Set<String> rebound, Set<String> mutated, Set<String> declared, boolean hasCalls) {
}
