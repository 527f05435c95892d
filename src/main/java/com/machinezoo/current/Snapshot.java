// Part of Current
package com.machinezoo.current;

import java.util.*;

/**
 * {@link Output} together with the {@link Watch}es consulted while producing it.
 * This is the result of {@link Input#get()} and {@link Evaluator#evaluate()}.
 *
 * @param <T>
 *            type of the successful result
 */
public class Snapshot<T> {
	private final Output<T> output;
	public Output<T> output() {
		return output;
	}
	private final List<Watch> watches;
	public List<Watch> watches() {
		return watches;
	}
	public Snapshot(Output<T> output, List<Watch> watches) {
		Objects.requireNonNull(output);
		Objects.requireNonNull(watches);
		for (Watch watch : watches)
			Objects.requireNonNull(watch);
		this.output = output;
		this.watches = Collections.unmodifiableList(new ArrayList<>(watches));
	}
	public Snapshot(Output<T> output, Watch... watches) {
		this(output, Arrays.asList(watches));
	}
	@Override
	public String toString() {
		StringBuilder description = new StringBuilder();
		description.append(output).append(" watching [");
		for (int i = 0; i < watches.size(); ++i) {
			if (i > 0)
				description.append(", ");
			description.append(watches.get(i).describe());
		}
		return description.append("]").toString();
	}
}
