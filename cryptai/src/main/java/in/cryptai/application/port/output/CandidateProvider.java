package in.cryptai.application.port.output;

import java.util.Set;

/**
 * Output port: lists the currently tradable entities.
 * The active flag is owned elsewhere; generation only reads it.
 */
public interface CandidateProvider {

    Set<String> listActive();
}
