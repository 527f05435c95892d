// Part of Current
package com.machinezoo.current.util;

import java.nio.file.*;
import java.util.*;
import com.machinezoo.noexception.*;
import com.machinezoo.stagean.*;

/**
 * Writable per-resource directories under explicitly configured root.
 * Monitor drivers use it to keep state, for example caches of downloaded artifacts.
 */
@StubDocs
public class StateDirectory {
	private final Path root;
	public Path root() {
		return root;
	}
	public StateDirectory(Path root) {
		Objects.requireNonNull(root);
		this.root = root.toAbsolutePath().normalize();
	}
	/**
	 * Creates state directory rooted at {@code var} subdirectory of the current working directory.
	 *
	 * @return state directory in the working directory
	 */
	public static StateDirectory workingDirectory() {
		return new StateDirectory(Paths.get("").toAbsolutePath().resolve("var"));
	}
	/**
	 * Resolves named directory under the root and creates it if it does not exist yet.
	 *
	 * @param name
	 *            relative path of the directory
	 * @return absolute path of the existing directory
	 * @throws IllegalArgumentException
	 *             if {@code name} is absolute or escapes the root
	 * @throws WrappedException
	 *             if the directory cannot be created
	 */
	public Path resolve(String name) {
		Objects.requireNonNull(name);
		Path relative = Paths.get(name);
		if (relative.isAbsolute())
			throw new IllegalArgumentException("State directory name must be relative: " + name);
		Path path = root.resolve(relative).normalize();
		if (!path.startsWith(root))
			throw new IllegalArgumentException("State directory must be under " + root + ": " + name);
		return Exceptions.wrap().get(() -> Files.createDirectories(path));
	}
	@Override
	public String toString() {
		return "state directory " + root;
	}
}
