/**
 * Full-duplex turn controller: the four session loops, the duplex state machine, interruption
 * and backchannel rules, and the event fan-out.
 *
 * <p>Entry point is {@link com.phillippitts.duplexvoice.service.duplex.DuplexController}, built
 * with {@link com.phillippitts.duplexvoice.service.duplex.DuplexControllerBuilder}.
 */
package com.phillippitts.duplexvoice.service.duplex;
