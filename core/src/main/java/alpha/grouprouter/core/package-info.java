/**
 * Home of the library-provided application implementation.<p>
 * 
 * The only public type in this package is {@link
 * alpha.grouprouter.core.DefaultAppFactory}, which is the service provider
 * used by {@link alpha.grouprouter.App#create(alpha.grouprouter.Config)}. All
 * other types in this package can therefore be regarded as an implementation
 * detail.<p>
 * 
 * Implementations of public interfaces use the "Default" name-prefix. For
 * example, {@code DefaultGroup} implements {@code Group}. The registration
 * table is simply the {@code RouteTable}.<p>
 * 
 * Unless documented differently, all methods within this package expect to be
 * given non-null arguments and will return non-null results.
 */
package alpha.grouprouter.core;
