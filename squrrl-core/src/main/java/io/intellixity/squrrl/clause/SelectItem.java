package io.intellixity.squrrl.clause;

/** One projected item: {@link ExpressionItem}, {@link AliasedItem} or {@link WindowItem}. */
public interface SelectItem {
}
