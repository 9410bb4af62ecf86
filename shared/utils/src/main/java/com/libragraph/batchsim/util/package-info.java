/**
 * Shared utilities for all batchsim modules.
 *
 * <p>Contains {@link com.libragraph.batchsim.util.ConfigMaps} (config-tree copying and
 * coercion) and the {@link com.libragraph.batchsim.util.image pixel layer}
 * (PixelImage, ImageSize). No framework dependencies.
 */
package com.libragraph.batchsim.util;
