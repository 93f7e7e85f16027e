/**
 * Home of the library-provided implementation.<p>
 * 
 * The entry point is {@link alpha.handlerkit.core.Application}, which adapts
 * each {@link alpha.handlerkit.handler.Handler} into a {@link
 * alpha.handlerkit.core.HandlerAdapter}; a servlet that the hosting container
 * mounts. The other public types are default implementations of collaborator
 * interfaces, {@link alpha.handlerkit.core.OperatorNotifier} and {@link
 * alpha.handlerkit.core.SchemaFormDecoder}. All other types in this package
 * are an implementation detail.<p>
 * 
 * Unless documented differently, all methods within this package expect to be
 * given non-null arguments and will return non-null results.
 */
package alpha.handlerkit.core;
