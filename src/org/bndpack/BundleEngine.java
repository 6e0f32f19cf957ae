package org.bndpack;

import java.io.IOException;
import java.util.Map;

/**
 * The analysis and build engine generating the bundle. Implementations must not
 * be shared between concurrent builds.
 */
public interface BundleEngine {
	/**
	 * Builds the bundle described by this context with these resolved
	 * instructions. Engine problems are returned as diagnostics, only host I/O
	 * failures are thrown.
	 */
	BuildResult build(BuildContext context, Map<String, String> instructions) throws IOException;
}
