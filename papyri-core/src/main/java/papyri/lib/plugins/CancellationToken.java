/*-
 * #%L
 * This file is part of Papyri.
 * %%
 * Copyright (C) 2023 - 2024 Papyri developers
 * %%
 * Papyri is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 * 
 * Papyri is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 * 
 * You should have received a copy of the GNU General Public License 
 * along with Papyri.  If not, see <https://www.gnu.org/licenses/>.
 * #L%
 */

package papyri.lib.plugins;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag.
 * <p>
 * Cancellation may be requested from any thread, e.g. a user interface.
 * Long-running tasks check {@link #isCancellationRequested()} at fixed checkpoints and then ask a
 * {@link CancellationHandler} whether to abort or resume.
 *
 * @author Papyri developers
 */
public class CancellationToken {

	private final AtomicBoolean requested = new AtomicBoolean(false);

	/**
	 * Request cancellation.
	 */
	public void cancel() {
		requested.set(true);
	}

	/**
	 * Query if cancellation has been requested since the token was created or last reset.
	 * @return
	 */
	public boolean isCancellationRequested() {
		return requested.get();
	}

	/**
	 * Clear any pending request, e.g. after the user chose to resume.
	 */
	public void reset() {
		requested.set(false);
	}

}
