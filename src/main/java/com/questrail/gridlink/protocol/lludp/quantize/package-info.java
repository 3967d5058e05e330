/**
 * Quantization Codec
 * =============================================================================
 *
 * <p>Bit-level decoding of compressed movement and object fields:</p>
 * <ul>
 *   <li>{@link com.questrail.gridlink.protocol.lludp.quantize.BitPacking}: MSB-first bit fields</li>
 *   <li>{@link com.questrail.gridlink.protocol.lludp.quantize.Quantizer}: integer to bounded float</li>
 *   <li>{@link com.questrail.gridlink.protocol.lludp.quantize.UpdateKind}: constant field tables</li>
 *   <li>{@link com.questrail.gridlink.protocol.lludp.quantize.RotationPacking}: three-component quaternions</li>
 * </ul>
 *
 * <p>Nothing here is tied to a circuit. Handlers call into this package to
 * interpret packet bodies.</p>
 */
package com.questrail.gridlink.protocol.lludp.quantize;
