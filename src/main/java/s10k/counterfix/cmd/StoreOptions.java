package s10k.counterfix.cmd;

import java.io.IOException;
import java.nio.file.Path;

import picocli.CommandLine.Option;
import s10k.counterfix.config.AggregateStoreFactory;
import s10k.counterfix.store.AggregateStore;

/**
 * Options shared by commands that work against an aggregate store.
 */
public class StoreOptions {

	@Option(names = { "-v", "--verbose" }, description = "verbose output")
	boolean[] verbosity;

	@Option(names = { "--http-trace" }, description = "trace HTTP exchanges")
	boolean traceHttp;

	@Option(names = { "--base-url" }, description = "the statistics API base URL")
	String baseUrl;

	@Option(names = { "--token" }, description = "the statistics API access token")
	String token;

	@Option(names = { "--store-file" }, description = "a statistics JSON file to use instead of the API")
	Path storeFile;

	/**
	 * Test if verbose output is requested.
	 * 
	 * @return {@code true} if at least one {@code -v} was given
	 */
	public boolean isVerbose() {
		return verbosity != null && verbosity.length > 0;
	}

	/**
	 * Create the store these options describe.
	 * 
	 * @param factory the factory
	 * @return the store
	 * @throws IOException if the store file cannot be loaded
	 */
	public AggregateStore createStore(AggregateStoreFactory factory) throws IOException {
		return factory.createStore(storeFile, baseUrl, token, traceHttp);
	}

}
