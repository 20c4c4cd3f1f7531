// Part of PMNginx
package com.machinezoo.pmnginx;

import java.util.*;
import org.eclipse.jetty.io.Connection;
import org.slf4j.*;
import com.google.common.collect.Sets;

/*
 * Jetty would wait for idle keep-alive connections to time out before it finishes stopping.
 * NginxServer instead closes every open connection when it stops. Connections are registered
 * by Jetty callbacks from many threads, so the set is concurrent, but only NginxServer holds this object.
 */
class LiveConnections {
	private static final Logger logger = LoggerFactory.getLogger(LiveConnections.class);
	private final Set<Connection> connections = Sets.newConcurrentHashSet();
	void register(Connection connection) {
		connections.add(connection);
	}
	void unregister(Connection connection) {
		connections.remove(connection);
	}
	int size() {
		return connections.size();
	}
	/*
	 * Closes endpoints directly instead of asking connections to close gracefully.
	 */
	int terminateAll() {
		int count = 0;
		for (var connection : List.copyOf(connections)) {
			connection.getEndPoint().close();
			connections.remove(connection);
			++count;
		}
		if (count > 0)
			logger.debug("Terminated {} live connections.", count);
		return count;
	}
	Connection.Listener listener() {
		return new Connection.Listener() {
			@Override public void onOpened(Connection connection) {
				register(connection);
			}
			@Override public void onClosed(Connection connection) {
				unregister(connection);
			}
		};
	}
}
