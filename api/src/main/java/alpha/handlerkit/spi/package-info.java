/**
 * Collaborators the library uses, but does not implement.<p>
 * 
 * The application provides a {@link alpha.handlerkit.spi.TemplateRenderer}
 * and a {@link alpha.handlerkit.spi.MailSender} backed by the template engine
 * and mail transport of its choosing. A default {@link
 * alpha.handlerkit.spi.FormDecoder} is provided by the core module.<p>
 * 
 * Each collaborator signals failure with a checked exception, which the
 * library either classifies into a response or logs.
 */
package alpha.handlerkit.spi;
