package com.github.micycle1.deblender.constraint;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Resolved constraint selection: for each {@link ConstraintType} requested by
 * any component, a seeks vector of length K+G. Garbage-collector components
 * (the trailing G slots) never seek a constraint.
 */
public final class ConstraintSpec {

	private final Map<ConstraintType, boolean[]> seeks;
	private final int components;

	private ConstraintSpec(Map<ConstraintType, boolean[]> seeks, int components) {
		this.seeks = seeks;
		this.components = components;
	}

	/** No constraints at all. */
	public static ConstraintSpec none(int declared, int garbage) {
		return new ConstraintSpec(new EnumMap<>(ConstraintType.class), declared + garbage);
	}

	/**
	 * Every declared component seeks every constraint in {@code types}, e.g.
	 * {@code "MS"}.
	 */
	public static ConstraintSpec uniform(String types, int declared, int garbage) {
		Map<ConstraintType, boolean[]> map = new EnumMap<>(ConstraintType.class);
		if (types != null) {
			for (char c : types.toCharArray()) {
				ConstraintType t = ConstraintType.fromSymbol(c);
				boolean[] s = new boolean[declared + garbage];
				for (int k = 0; k < declared; k++) {
					s[k] = true;
				}
				map.put(t, s);
			}
		}
		return new ConstraintSpec(map, declared + garbage);
	}

	/**
	 * One constraint string per component; a null or empty entry means no
	 * constraints for that component. The list holds either the K declared
	 * components or all K+G, in which case the garbage-collector entries are
	 * ignored.
	 */
	public static ConstraintSpec perComponent(List<String> perComponent, int declared, int garbage) {
		if (perComponent.size() != declared && perComponent.size() != declared + garbage) {
			throw new IllegalArgumentException(
					"Expected " + declared + " or " + (declared + garbage) + " constraint entries but got " + perComponent.size());
		}
		Map<ConstraintType, boolean[]> map = new EnumMap<>(ConstraintType.class);
		for (int k = 0; k < declared; k++) {
			String types = perComponent.get(k);
			if (types == null) {
				continue;
			}
			for (char c : types.toCharArray()) {
				ConstraintType t = ConstraintType.fromSymbol(c);
				map.computeIfAbsent(t, x -> new boolean[declared + garbage])[k] = true;
			}
		}
		return new ConstraintSpec(map, declared + garbage);
	}

	public boolean isEmpty() {
		return seeks.isEmpty();
	}

	public int getComponentCount() {
		return components;
	}

	/** Requested types, in declaration order of {@link ConstraintType}. */
	public Map<ConstraintType, boolean[]> getSeeks() {
		return Collections.unmodifiableMap(seeks);
	}

	public boolean[] seeks(ConstraintType type) {
		boolean[] s = seeks.get(type);
		return s == null ? new boolean[components] : s.clone();
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder("ConstraintSpec{");
		for (Map.Entry<ConstraintType, boolean[]> e : seeks.entrySet()) {
			sb.append(e.getKey().getSymbol()).append('=');
			for (boolean b : e.getValue()) {
				sb.append(b ? '1' : '0');
			}
			sb.append(' ');
		}
		return sb.append('}').toString();
	}
}
